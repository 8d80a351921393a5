package com.fintech.savings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Round-Up Savings Service
 *
 * Turns a transaction ledger into retirement savings projections.
 *
 * Architecture:
 * - Every transaction is rounded up to the next multiple of 100; the round-up is invested
 * - Negative and duplicate transactions are rejected per request
 * - Override (q), bonus (p) and evaluation (k) periods reshape and bucket the round-ups
 * - Each evaluation period is compounded to age 60 under the NPS or index preset,
 *   deflated by inflation, with the NPS income-tax benefit where applicable
 *
 * Every computation is synchronous and stateless; nothing is persisted.
 */
@SpringBootApplication
public class RoundUpSavingsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoundUpSavingsApplication.class, args);
    }
}
