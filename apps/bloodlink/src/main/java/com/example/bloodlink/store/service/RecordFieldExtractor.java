package com.example.bloodlink.store.service;

import com.example.bloodlink.store.document.StoredRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a stored record into the field map the access policy compares.
 * Store bookkeeping (the optimistic-lock version) is left out.
 */
@Component
public class RecordFieldExtractor {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {};
    private static final Set<String> BOOKKEEPING_FIELDS = Set.of("version");

    private final ObjectMapper objectMapper;

    public RecordFieldExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> fieldsOf(StoredRecord record) {
        Map<String, Object> fields = objectMapper.convertValue(record, FIELD_MAP);
        fields.keySet().removeAll(BOOKKEEPING_FIELDS);
        return fields;
    }
}
