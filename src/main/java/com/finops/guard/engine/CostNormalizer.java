package com.finops.guard.engine;

import com.finops.guard.model.RawCostRow;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Fills missing fields of raw cost rows in place so that every row has
 * day, account, service and tag. Blank strings count as missing.
 */
@Component
public class CostNormalizer {

    static final String UNKNOWN = "unknown";
    static final String UNALLOCATED = "unallocated";

    private final Clock clock;

    public CostNormalizer(Clock clock) {
        this.clock = clock;
    }

    public List<RawCostRow> normalize(List<RawCostRow> rows) {
        String today = LocalDate.now(clock).toString();
        for (RawCostRow row : rows) {
            if (isBlank(row.getDay())) row.setDay(today);
            if (isBlank(row.getAccount())) row.setAccount(UNKNOWN);
            if (isBlank(row.getService())) row.setService(UNKNOWN);
            if (isBlank(row.getTag())) row.setTag(UNALLOCATED);
        }
        return rows;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
