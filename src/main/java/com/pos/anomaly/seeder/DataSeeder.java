package com.pos.anomaly.seeder;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.model.ShiftRecord;
import com.pos.anomaly.repository.ShiftRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeds Aerospike with synthetic shift data for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Writes one AM and one PM shift per day for every configured store over the
 * baseline window. The last store gets a low-sales streak in its final shifts
 * so that the first analysis run raises an alert.
 */
@Component
@Profile("seed")
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final int AM_OPEN_HOUR = 6;
    private static final int PM_OPEN_HOUR = 17;
    private static final int SHIFT_HOURS = 7;
    private static final int INJECTED_RUN_LENGTH = 4;

    private final ShiftRecordRepository shiftRepository;
    private final DetectionConfig config;
    private final Clock clock;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(ShiftRecordRepository shiftRepository, DetectionConfig config, Clock clock) {
        this.shiftRepository = shiftRepository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting shift seeding ===");

        List<String> storeIds = new ArrayList<>(config.getStores().keySet());
        if (storeIds.isEmpty()) {
            storeIds = List.of("STORE-001", "STORE-002", "STORE-003");
        }

        ZoneOffset zone = config.storeZone();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        LocalDate firstDay = today.minusDays(config.getBaselineDays() - 1L);

        int total = 0;
        for (int s = 0; s < storeIds.size(); s++) {
            String storeId = storeIds.get(s);
            boolean injectRun = s == storeIds.size() - 1;
            List<ShiftRecord> shifts = generateStore(storeId, s, firstDay, today, zone, injectRun);
            shiftRepository.saveAll(shifts);
            total += shifts.size();
            log.info("Seeded {} shifts for store {} ({}){}", shifts.size(), storeId,
                    config.storeName(storeId), injectRun ? " with an injected low-sales run" : "");
        }

        log.info("=== Shift seeding complete: {} shifts ===", total);
    }

    private List<ShiftRecord> generateStore(String storeId, int storeIndex, LocalDate firstDay,
                                            LocalDate lastDay, ZoneOffset zone, boolean injectRun) {
        double baseSales = 15_000 + storeIndex * 4_000;
        List<ShiftRecord> shifts = new ArrayList<>();
        int seq = 0;

        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            double dayFactor = day.getDayOfWeek() == DayOfWeek.SATURDAY
                    || day.getDayOfWeek() == DayOfWeek.SUNDAY ? 1.3 : 1.0;

            for (int openHour : new int[]{AM_OPEN_HOUR, PM_OPEN_HOUR}) {
                LocalDateTime opened = day.atTime(openHour, random.nextInt(30));
                if (!opened.toInstant(zone).isBefore(clock.instant())) {
                    continue;
                }
                double slotFactor = openHour == PM_OPEN_HOUR ? 1.2 : 1.0;
                double sales = Math.max(0, baseSales * dayFactor * slotFactor
                        * (1 + random.nextGaussian() * 0.08));

                shifts.add(ShiftRecord.builder()
                        .shiftId(String.format("SHIFT-%s-%06d", storeId, ++seq))
                        .storeId(storeId)
                        .openedAt(opened.toInstant(zone))
                        .closedAt(opened.plusHours(SHIFT_HOURS).toInstant(zone))
                        .totalSales(Math.round(sales * 100) / 100.0)
                        .productACount((long) random.nextInt(4))
                        .productBCount(8L + random.nextInt(8))
                        .build());
            }
        }

        if (injectRun) {
            int from = Math.max(0, shifts.size() - INJECTED_RUN_LENGTH);
            for (ShiftRecord shift : shifts.subList(from, shifts.size())) {
                shift.setTotalSales(Math.round(shift.getTotalSales() * 0.4 * 100) / 100.0);
                shift.setProductACount(6L);
                shift.setProductBCount(2L);
            }
        }
        return shifts;
    }
}
