package com.relcore.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for tests.
 *
 * <p>Subclasses override {@link #doSetUp()} and {@link #doTearDown()} rather
 * than declaring their own lifecycle methods, and narrate Given/When/Then
 * steps with {@link #logStep(String)}.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    final void setUpBase(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
        doSetUp();
    }

    @AfterEach
    final void tearDownBase() {
        try {
            doTearDown();
        } finally {
            logger.debug("Finished test: {}", testName);
        }
    }

    protected void doSetUp() {
    }

    protected void doTearDown() {
    }

    protected void logStep(String step) {
        logger.info("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {}: {}", testName, label, value);
    }
}
