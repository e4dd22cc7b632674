package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all Tempo examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== Tempo Examples ===\n");

        // Run all examples
        BasicExample.main(args);
        ScheduledJobsExample.main(args);
        ContinuationExample.main(args);
        RecurringJobExample.main(args);
        InjectedDependenciesExample.main(args);
        RetryExample.main(args);
        RecoveryExample.main(args);
        BackgroundWorkersExample.main(args);
        JsonExample.main(args);
        KryoExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
