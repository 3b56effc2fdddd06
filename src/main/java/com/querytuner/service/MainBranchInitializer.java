package com.querytuner.service;

import com.querytuner.model.branch.Branch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the root branch exists before the first request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MainBranchInitializer implements ApplicationRunner {

    private final VersionGraphService versionGraph;

    @Override
    public void run(ApplicationArguments args) {
        Branch main = versionGraph.ensureMainBranch();
        log.info("Main branch ready: '{}' ({})", main.getName(), main.getId());
    }
}
