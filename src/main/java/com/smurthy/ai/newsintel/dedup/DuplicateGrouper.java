package com.smurthy.ai.newsintel.dedup;

import com.smurthy.ai.newsintel.model.CorpusDocument;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Groups a batch of articles into coverage groups: identical texts first, then
 * near-duplicates found by MinHash.
 *
 * Each group is keyed by its representative, the earliest article of the group in input order.
 * Articles with blank text are left out. Article ids must be unique within a batch.
 */
public class DuplicateGrouper {

    private static final Logger log = LoggerFactory.getLogger(DuplicateGrouper.class);

    private final Supplier<MinHashDeduplicator> deduplicatorFactory;

    public DuplicateGrouper(Supplier<MinHashDeduplicator> deduplicatorFactory) {
        this.deduplicatorFactory = deduplicatorFactory;
    }

    /**
     * @return representative id to the ids in its group (representative included), in input order
     * @throws IllegalArgumentException if two articles share an id
     */
    public Map<String, Set<String>> groupDuplicates(List<CorpusDocument> documents) {
        // Exact duplicates collapse onto the first article carrying that text
        Map<String, List<String>> idsByDigest = new LinkedHashMap<>();
        Map<String, String> textByRepresentative = new LinkedHashMap<>();
        Set<String> seenIds = new HashSet<>();
        for (CorpusDocument doc : documents) {
            if (!seenIds.add(doc.id())) {
                throw new IllegalArgumentException("Duplicate article id: " + doc.id());
            }
            if (doc.text().isEmpty()) {
                continue;
            }
            String digest = DigestUtils.md5Hex(doc.text());
            List<String> ids = idsByDigest.computeIfAbsent(digest, k -> new ArrayList<>());
            if (ids.isEmpty()) {
                textByRepresentative.put(doc.id(), doc.text());
            }
            ids.add(doc.id());
        }

        List<String> representatives = new ArrayList<>(textByRepresentative.keySet());
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < representatives.size(); i++) {
            order.put(representatives.get(i), i);
        }

        MinHashDeduplicator deduplicator = deduplicatorFactory.get();
        deduplicator.addDocumentsBatch(textByRepresentative);

        // Union the near-duplicate pairs; the root of a set is its earliest representative
        int[] parent = new int[representatives.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (MinHashDeduplicator.DuplicatePair pair : deduplicator.findDuplicates(null, null)) {
            int a = find(parent, order.get(pair.firstId()));
            int b = find(parent, order.get(pair.secondId()));
            if (a != b) {
                parent[Math.max(a, b)] = Math.min(a, b);
            }
        }

        Map<String, Set<String>> groups = new LinkedHashMap<>();
        List<List<String>> exactGroups = new ArrayList<>(idsByDigest.values());
        for (int i = 0; i < representatives.size(); i++) {
            String root = representatives.get(find(parent, i));
            groups.computeIfAbsent(root, k -> new LinkedHashSet<>()).addAll(exactGroups.get(i));
        }

        log.info("Grouped {} articles into {} coverage groups", documents.size(), groups.size());
        return groups;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }
}
