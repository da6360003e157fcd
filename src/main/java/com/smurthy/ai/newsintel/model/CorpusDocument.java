package com.smurthy.ai.newsintel.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A single corpus entry handed to the engine by the ingestion pipeline.
 *
 * The id is required and validated here, once, so the index, deduplicator and
 * snapshot code never re-check it. A missing text is treated as empty.
 */
public record CorpusDocument(String id, String text) {

    public CorpusDocument {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Corpus document id must not be blank");
        }
        text = text == null ? "" : text;
    }

    /**
     * Convert loosely typed records (e.g. rows decoded from JSON) into corpus documents.
     * Records without a usable id are skipped rather than rejected.
     *
     * @param records   map-shaped records
     * @param idField   key holding the document id
     * @param textField key holding the document text
     * @return documents in input order
     */
    public static List<CorpusDocument> fromRecords(List<? extends Map<String, ?>> records,
                                                   String idField,
                                                   String textField) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        List<CorpusDocument> documents = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            if (record == null) {
                continue;
            }
            Object id = record.get(idField);
            if (id == null || id.toString().isBlank()) {
                continue;
            }
            Object text = record.get(textField);
            documents.add(new CorpusDocument(id.toString(), text == null ? "" : text.toString()));
        }
        return documents;
    }
}
