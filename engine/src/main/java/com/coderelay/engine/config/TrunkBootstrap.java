package com.coderelay.engine.config;

import com.coderelay.engine.tree.VersionedTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the trunk repository exists before any worker registers.
 */
@Component
public class TrunkBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TrunkBootstrap.class);

    private final VersionedTree tree;

    public TrunkBootstrap(VersionedTree tree) {
        this.tree = tree;
    }

    @Override
    public void run(ApplicationArguments args) {
        String head = tree.initTrunk();
        log.info("Trunk '{}' ready at {}", tree.trunkBranch(), head);
    }
}
