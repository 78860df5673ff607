package com.peakrank.service;

import com.peakrank.controller.dto.SubmissionRequests;
import com.peakrank.model.Challenge;
import com.peakrank.model.ProofType;
import com.peakrank.web.GradingException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

/**
 * Checks that a submission carries the evidence its declared proof type needs.
 * Runs before any state is touched.
 */
@Component
public class ProofValidator {

    public void validate(SubmissionRequests.SubmitRequest request, Challenge challenge) {
        ProofType proofType = request.proofType();
        if (proofType == null) {
            throw GradingException.validation("proofType", "proofType is required");
        }
        if (challenge.getProofTypes() != null
                && !challenge.getProofTypes().isEmpty()
                && !challenge.getProofTypes().contains(proofType)) {
            throw GradingException.validation(
                    "proofType",
                    "Challenge " + challenge.getChallengeId() + " does not accept " + proofType + " proof"
            );
        }

        switch (proofType) {
            case VIDEO -> require(request.videoUrl(), "videoUrl", proofType);
            case IMAGE -> require(request.imageUrl(), "imageUrl", proofType);
            case STRAVA -> require(request.stravaActivityId(), "stravaActivityId", proofType);
            case GARMIN -> require(request.garminActivityId(), "garminActivityId", proofType);
            case RACE_RESULT -> {
                if (!StringUtils.hasText(request.imageUrl()) && !StringUtils.hasText(request.videoUrl())) {
                    throw GradingException.validation(
                            "imageUrl",
                            "RACE_RESULT proof requires an imageUrl or videoUrl"
                    );
                }
            }
            case MANUAL -> {
                if (request.supervisorId() == null) {
                    throw GradingException.validation("supervisorId", "MANUAL proof requires a supervisorId");
                }
            }
        }

        validateAchievedValue(request.achievedValue());
    }

    public void validateAchievedValue(BigDecimal achievedValue) {
        if (achievedValue != null && achievedValue.signum() <= 0) {
            throw GradingException.validation("achievedValue", "achievedValue must be positive");
        }
    }

    private static void require(String value, String field, ProofType proofType) {
        if (!StringUtils.hasText(value)) {
            throw GradingException.validation(field, proofType + " proof requires " + field);
        }
    }
}
