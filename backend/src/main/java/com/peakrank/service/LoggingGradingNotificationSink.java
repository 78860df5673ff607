package com.peakrank.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingGradingNotificationSink implements GradingNotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingGradingNotificationSink.class);

    @Override
    public void deliver(GradingEvent event) {
        log.info(
                "Grading event {} athlete={} submission={} tier={} xp={} rank={}",
                event.type(),
                event.athleteId(),
                event.submissionId(),
                event.achievedTier(),
                event.xpAwarded(),
                event.rankName()
        );
    }
}
