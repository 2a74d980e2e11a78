package com.example.purgejobs.service;

import com.example.purgejobs.access.ParameterAccess;
import com.example.purgejobs.config.JobsProperties;
import com.example.purgejobs.models.Parameter;
import com.example.purgejobs.models.RevalidationFlag;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Store-held runtime settings. Read on every call so that operators can flip them without a
 * restart.
 */
@Service
@Slf4j
public class GlobalParameters {

    private final ParameterAccess parameterAccess;
    private final JobsProperties properties;

    public GlobalParameters(ParameterAccess parameterAccess, JobsProperties properties) {
        this.parameterAccess = parameterAccess;
        this.properties = properties;
    }

    /**
     * {@code use_reval_pending} absent or "0" means full config updates; anything else turns on
     * incremental revalidation.
     */
    public RevalidationFlag revalidationFlag() {
        String value = parameterAccess.find(Parameter.USE_REVAL_PENDING, Parameter.GLOBAL_CONFIG_FILE)
                .map(Parameter::getValue)
                .orElse("0");
        return "0".equals(value.trim()) ? RevalidationFlag.UPDATE_PENDING : RevalidationFlag.REVALIDATION_PENDING;
    }

    public int maxRevalDurationDays() {
        Optional<String> value = parameterAccess
                .find(Parameter.MAX_REVAL_DURATION_DAYS, Parameter.REGEX_REVALIDATE_CONFIG_FILE)
                .map(Parameter::getValue);
        if (value.isEmpty()) {
            return properties.getDefaultRecencyWindowDays();
        }
        int days;
        try {
            days = Integer.parseInt(value.get().trim());
        } catch (NumberFormatException ex) {
            days = 0;
        }
        if (days <= 0) {
            log.warn("Ignoring invalid {} parameter value '{}'", Parameter.MAX_REVAL_DURATION_DAYS, value.get());
            return properties.getDefaultRecencyWindowDays();
        }
        return days;
    }

    /**
     * Profiles whose servers read regex_revalidate.config and therefore act on jobs.
     */
    public Set<String> revalidatingProfiles() {
        return parameterAccess.find(Parameter.LOCATION, Parameter.REGEX_REVALIDATE_CONFIG_FILE)
                .map(Parameter::getProfiles)
                .map(Set::copyOf)
                .orElse(Set.of());
    }
}
