package com.pos.anomaly.service;

import com.pos.anomaly.model.ShiftRecord;
import com.pos.anomaly.repository.ShiftRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ShiftService {

    private static final Logger log = LoggerFactory.getLogger(ShiftService.class);

    private final ShiftRecordRepository shiftRepository;

    public ShiftService(ShiftRecordRepository shiftRepository) {
        this.shiftRepository = shiftRepository;
    }

    /**
     * Validates every row first, then upserts them all by shift id.
     *
     * @return number of rows stored
     * @throws IllegalArgumentException naming the first invalid row; nothing is stored in that case
     */
    public int saveAll(List<ShiftRecord> shifts) {
        for (ShiftRecord shift : shifts) {
            validate(shift);
        }
        shiftRepository.saveAll(shifts);
        log.info("Stored {} shifts", shifts.size());
        return shifts.size();
    }

    public ShiftRecord getShift(String shiftId) {
        return shiftRepository.findById(shiftId);
    }

    public List<ShiftRecord> getShiftsByStore(String storeId, int limit) {
        return shiftRepository.findByStoreId(storeId, limit);
    }

    private void validate(ShiftRecord shift) {
        if (shift == null) {
            throw new IllegalArgumentException("shift rows must not contain null entries");
        }
        if (shift.getShiftId() == null || shift.getShiftId().isBlank()) {
            throw new IllegalArgumentException("shiftId is required");
        }
        if (shift.getStoreId() == null || shift.getStoreId().isBlank()) {
            throw new IllegalArgumentException("storeId is required for shift " + shift.getShiftId());
        }
        if (shift.getOpenedAt() == null) {
            throw new IllegalArgumentException("openedAt is required for shift " + shift.getShiftId());
        }
        if (shift.getTotalSales() < 0) {
            throw new IllegalArgumentException("totalSales must be >= 0 for shift " + shift.getShiftId());
        }
        if ((shift.getProductACount() != null && shift.getProductACount() < 0)
                || (shift.getProductBCount() != null && shift.getProductBCount() < 0)) {
            throw new IllegalArgumentException("product counts must be >= 0 for shift " + shift.getShiftId());
        }
    }
}
