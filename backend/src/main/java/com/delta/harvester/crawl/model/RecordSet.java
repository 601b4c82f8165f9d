package com.delta.harvester.crawl.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RecordSet {
    private final Map<String, CompanyRecord> byIdentity = new LinkedHashMap<>();

    public boolean add(CompanyRecord record) {
        return byIdentity.putIfAbsent(record.identityKey(), record) == null;
    }

    public boolean contains(String identityKey) {
        return byIdentity.containsKey(identityKey);
    }

    public CompanyRecord get(String identityKey) {
        return byIdentity.get(identityKey);
    }

    public int size() {
        return byIdentity.size();
    }

    public boolean isEmpty() {
        return byIdentity.isEmpty();
    }

    public List<CompanyRecord> snapshot() {
        return List.copyOf(byIdentity.values());
    }

    public List<List<CompanyRecord>> chunks(int chunkSize) {
        int size = Math.max(1, chunkSize);
        List<CompanyRecord> ordered = snapshot();
        List<List<CompanyRecord>> out = new ArrayList<>();
        for (int start = 0; start < ordered.size(); start += size) {
            out.add(ordered.subList(start, Math.min(ordered.size(), start + size)));
        }
        return out;
    }

    public long countByStatus(RecordStatus status) {
        return byIdentity.values().stream().filter(record -> record.status() == status).count();
    }
}
