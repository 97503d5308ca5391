package com.supporters.domain.payment;

import com.supporters.domain.calendar.MonthDate;

import java.util.Objects;

/**
 * A single recorded payment. Amount and payee are carried through untouched.
 */
public record Payment(
        MonthDate date,
        String entity,
        String payee,
        String program,     // e.g. "General Fund:Monthly"; may be null
        String amount
) {
    public Payment {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(entity, "entity");
        if (entity.isBlank()) throw new IllegalArgumentException("entity is blank");
    }

    public static Payment of(String entity, MonthDate date, String program) {
        return new Payment(date, entity, null, program, null);
    }

    public boolean hasProgram() {
        return program != null && !program.isBlank();
    }

    public Cadence cadence() {
        return Cadence.fromProgram(program);
    }
}
