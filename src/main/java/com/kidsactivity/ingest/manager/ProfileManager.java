package com.kidsactivity.ingest.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsactivity.ingest.exception.DeviceNotFoundException;
import com.kidsactivity.ingest.model.profile.UserAgentProfile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Desktop browser fingerprints from {@code static/devices.json}, assigned to pooled sessions by
 * session id so a given pool slot presents the same profile on every run.
 */
@Component
@Slf4j
public class ProfileManager {

    private static final String EMOJI_DEVICE = "🖥️";
    private static final String EMOJI_WARNING = "⚠️";

    static final String DEVICES_RESOURCE = "static/devices.json";

    private final List<UserAgentProfile> profiles = new ArrayList<>();

    @PostConstruct
    void init() {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(DEVICES_RESOURCE)) {
            if (inputStream == null) {
                throw new IllegalStateException(DEVICES_RESOURCE + " not found in classpath.");
            }
            load(new ObjectMapper().readValue(inputStream, new TypeReference<List<UserAgentProfile>>() {}));
        } catch (DeviceNotFoundException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to load devices from JSON", e);
            throw new IllegalStateException("Device initialization failed", e);
        }
    }

    /**
     * Keeps only profiles a browser context can be built from.
     *
     * @throws DeviceNotFoundException if none are usable
     */
    void load(List<UserAgentProfile> candidates) {
        profiles.clear();
        for (UserAgentProfile profile : candidates) {
            if (isUsable(profile)) {
                profiles.add(profile);
            } else {
                log.warn("{} Skipping device profile '{}': missing user agent or viewport",
                        EMOJI_WARNING, profile == null ? null : profile.getId());
            }
        }
        if (profiles.isEmpty()) {
            throw new DeviceNotFoundException("No usable device profiles in " + DEVICES_RESOURCE);
        }
        log.info("{} Loaded {}/{} device profiles", EMOJI_DEVICE, profiles.size(), candidates.size());
    }

    public UserAgentProfile profileFor(int sessionId) {
        if (profiles.isEmpty()) {
            throw new DeviceNotFoundException("No device profiles loaded");
        }
        return profiles.get(Math.floorMod(sessionId, profiles.size()));
    }

    private static boolean isUsable(UserAgentProfile profile) {
        return profile != null
                && profile.getUserAgent() != null && !profile.getUserAgent().isBlank()
                && profile.getViewport() != null
                && profile.getViewport().getWidth() > 0 && profile.getViewport().getHeight() > 0;
    }
}
