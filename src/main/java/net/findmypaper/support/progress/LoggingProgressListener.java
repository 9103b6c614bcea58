package net.findmypaper.support.progress;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reports pipeline progress through the application log.
 */
@Component
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    @Override
    public void onStage(String stage) {
        log.info("{}..", stage);
    }

    @Override
    public void onStep(String stage, int completed, int total) {
        log.debug("{}: {}/{}", stage, completed, total);
    }
}
