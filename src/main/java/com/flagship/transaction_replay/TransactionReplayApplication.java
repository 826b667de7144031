package com.flagship.transaction_replay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Replays transaction CSV files into client accounts and prints the result as CSV.
 *
 * Usage: {@code java -jar transaction-replay.jar tx1.csv tx2.csv > accounts.csv}
 *
 * Exits with 0 once the accounts are written, non-zero if the export fails.
 */
@SpringBootApplication
public class TransactionReplayApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TransactionReplayApplication.class, args)));
    }
}
