package com.umitunal.examples;

import com.umitunal.tempo.config.SchedulerConfig;
import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.serialization.KryoCodec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Demonstrates compact binary handler arguments using Kryo.
 */
public class KryoExample {

    public static class OrderEvent {
        private String orderId;
        private String customerId;
        private List<String> productIds = new ArrayList<>();
        private double total;

        public OrderEvent() {}

        public OrderEvent(String orderId, String customerId, List<String> productIds, double total) {
            this.orderId = orderId;
            this.customerId = customerId;
            this.productIds = new ArrayList<>(productIds);
            this.total = total;
        }

        public String getOrderId() { return orderId; }
        public String getCustomerId() { return customerId; }
        public List<String> getProductIds() { return productIds; }
        public double getTotal() { return total; }

        @Override
        public String toString() {
            return "OrderEvent{orderId='" + orderId + "', customerId='" + customerId
                    + "', products=" + productIds + ", total=" + total + '}';
        }
    }

    public static void main(String[] args) {
        System.out.println("=== Kryo Arguments Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/tempo-kryo")
                .withDurableWrites(false)
                .build();
        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkerCount(2)
                .withPollInterval(Duration.ofSeconds(1))
                .withWorkerPollInterval(Duration.ofMillis(100))
                .build();

        try (JobScheduler scheduler = JobScheduler.open(storage, config)) {
            scheduler.registerHandler("process-order", new KryoCodec<>(OrderEvent.class),
                    (order, context) -> System.out.println("  Processing " + order));
            scheduler.start();

            for (int i = 1; i <= 3; i++) {
                OrderEvent order = new OrderEvent("ORD-" + i, "CUST-" + (100 + i),
                        List.of("PROD-A", "PROD-" + i), 49.99 * i);
                String jobId = scheduler.enqueue("process-order", order);
                System.out.println("Enqueued " + order.getOrderId() + " as job " + jobId);
            }

            Thread.sleep(1500);
            System.out.println("\n" + scheduler.monitoring().snapshot().getCountsByState());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
