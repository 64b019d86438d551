package com.flagship.general_ledger.ledger.port;

import lombok.Value;

import java.time.LocalDate;

@Value
public class FiscalYear {
    String name;
    LocalDate startDate;
    LocalDate endDate;

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
