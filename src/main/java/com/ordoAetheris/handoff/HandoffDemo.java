package com.ordoAetheris.handoff;

import com.ordoAetheris.handoff.config.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class HandoffDemo {

    private static final Logger log = LoggerFactory.getLogger(HandoffDemo.class);

    static final int EXIT_OK = 0;
    static final int EXIT_VERIFICATION_FAILED = 1;
    static final int EXIT_MISCONFIGURED = 2;

    public static void main(String[] args) throws Exception {
        // =====================================================================
        // One producer, one consumer, one bounded queue.
        //
        // - Producer: copies [1..items] into the queue, then the end-of-stream marker
        // - Queue(capacity): put() blocks on full, take() blocks on empty
        // - Consumer: drains into the destination list until the marker
        //
        // Misconfigured capacity -> exit 2, no thread started.
        // Destination != source -> exit 1.
        // =====================================================================
        int status = run(PipelineSettings.RESOURCE);
        if (status != EXIT_OK) System.exit(status);
    }

    static int run(String settingsResource) throws InterruptedException {
        PipelineSettings settings;
        try {
            settings = PipelineSettings.load(settingsResource);
        } catch (InvalidConfigurationException e) {
            log.error("Handoff demo aborted: {}", e.getMessage());
            return EXIT_MISCONFIGURED;
        }

        log.info("Running with {}", settings);
        PipelineResult<Integer> result = Pipeline.run(sequence(settings.itemCount()), settings);

        log.info("Source data:      {}", result.source());
        log.info("Destination data: {}", result.destination());
        log.info("Transfer successful: {}", result.success());

        return exitStatus(result);
    }

    static int exitStatus(PipelineResult<?> result) {
        return result.success() ? EXIT_OK : EXIT_VERIFICATION_FAILED;
    }

    static List<Integer> sequence(int n) {
        List<Integer> items = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) items.add(i);
        return items;
    }
}
