package com.payroll.processor;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.common.errors.GroupIdNotFoundException;
import org.apache.kafka.common.errors.GroupNotEmptyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.ExecutionException;

/**
 * Deletes the streams application's consumer group so the next start replays
 * every input topic from the earliest offset.
 */
final class ConsumerGroupReset {

    private static final Logger log = LoggerFactory.getLogger(ConsumerGroupReset.class);

    static final int MAX_ATTEMPTS = 6;
    private static final long RETRY_DELAY_MS = 10_000;

    enum Outcome { DELETED, NOT_FOUND, STILL_ACTIVE, FAILED }

    private ConsumerGroupReset() {}

    static void reset(String groupId, String bootstrapServers) {
        Properties adminProps = new Properties();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        try (AdminClient admin = AdminClient.create(adminProps)) {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                Outcome outcome = deleteGroup(admin, groupId);
                if (outcome != Outcome.STILL_ACTIVE) {
                    return;
                }
                // Members of the previous instance stay registered until their session times out
                log.info("Consumer group '{}' still has active members, retrying (attempt {}/{})",
                    groupId, attempt, MAX_ATTEMPTS);
                Thread.sleep(RETRY_DELAY_MS);
            }
            log.warn("Consumer group '{}' not deleted after {} attempts, starting from committed offsets",
                groupId, MAX_ATTEMPTS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("AdminClient error while resetting '{}': {}", groupId, e.getMessage());
        }
    }

    private static Outcome deleteGroup(AdminClient admin, String groupId) throws InterruptedException {
        Outcome outcome;
        try {
            admin.deleteConsumerGroups(Collections.singleton(groupId)).all().get();
            outcome = Outcome.DELETED;
        } catch (ExecutionException e) {
            outcome = outcomeOf(e.getCause());
            if (outcome == Outcome.FAILED) {
                log.warn("Failed to delete consumer group '{}': {}", groupId, e.getMessage());
            }
        }
        if (outcome == Outcome.DELETED) {
            log.info("Deleted consumer group '{}' for full replay", groupId);
        } else if (outcome == Outcome.NOT_FOUND) {
            log.info("Consumer group '{}' does not exist yet, nothing to reset", groupId);
        }
        return outcome;
    }

    static Outcome outcomeOf(Throwable failure) {
        if (failure instanceof GroupNotEmptyException) {
            return Outcome.STILL_ACTIVE;
        }
        if (failure instanceof GroupIdNotFoundException) {
            return Outcome.NOT_FOUND;
        }
        return Outcome.FAILED;
    }
}
