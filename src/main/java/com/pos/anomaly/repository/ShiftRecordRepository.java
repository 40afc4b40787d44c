package com.pos.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.pos.anomaly.config.AerospikeConfig;
import com.pos.anomaly.model.ShiftRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class ShiftRecordRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;

    public ShiftRecordRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
    }

    public void save(ShiftRecord shift) {
        Key key = new Key(namespace, AerospikeConfig.SET_SHIFTS, shift.getShiftId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("shiftId", shift.getShiftId()),
                new Bin("storeId", shift.getStoreId()),
                new Bin("openedAt", shift.getOpenedAt().toEpochMilli()),
                new Bin("totalSales", shift.getTotalSales())));

        if (shift.getClosedAt() != null) {
            bins.add(new Bin("closedAt", shift.getClosedAt().toEpochMilli()));
        }
        if (shift.getProductACount() != null) {
            bins.add(new Bin("productA", shift.getProductACount().longValue()));
        }
        if (shift.getProductBCount() != null) {
            bins.add(new Bin("productB", shift.getProductBCount().longValue()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public void saveAll(List<ShiftRecord> shifts) {
        for (ShiftRecord shift : shifts) {
            save(shift);
        }
    }

    public ShiftRecord findById(String shiftId) {
        Key key = new Key(namespace, AerospikeConfig.SET_SHIFTS, shiftId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Stored shifts of a store, newest first.
     */
    public List<ShiftRecord> findByStoreId(String storeId, int limit) {
        List<ShiftRecord> results = scan(record -> storeId.equals(record.getString("storeId")));
        results.sort(Comparator.comparing(ShiftRecord::getOpenedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * All stored shifts opened at or after the given instant, in no particular order.
     */
    public List<ShiftRecord> findOpenedSince(Instant since) {
        long sinceMillis = since.toEpochMilli();
        return scan(record -> record.getLong("openedAt") >= sinceMillis);
    }

    private List<ShiftRecord> scan(Predicate<Record> filter) {
        List<ShiftRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.maxRecords = 0;
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SHIFTS,
                (key, record) -> {
                    if (filter.test(record)) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });
        return results;
    }

    private ShiftRecord mapRecord(Record record) {
        return ShiftRecord.builder()
                .shiftId(record.getString("shiftId"))
                .storeId(record.getString("storeId"))
                .openedAt(Instant.ofEpochMilli(record.getLong("openedAt")))
                .closedAt(record.bins.containsKey("closedAt")
                        ? Instant.ofEpochMilli(record.getLong("closedAt")) : null)
                .totalSales(record.getDouble("totalSales"))
                .productACount(record.bins.containsKey("productA") ? record.getLong("productA") : null)
                .productBCount(record.bins.containsKey("productB") ? record.getLong("productB") : null)
                .build();
    }
}
