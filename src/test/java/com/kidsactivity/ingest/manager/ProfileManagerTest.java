package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.exception.DeviceNotFoundException;
import com.kidsactivity.ingest.model.profile.UserAgentProfile;
import com.kidsactivity.ingest.model.profile.ViewPort;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileManagerTest {

    private static UserAgentProfile profile(String id, String userAgent, ViewPort viewport) {
        return UserAgentProfile.builder().id(id).userAgent(userAgent).viewport(viewport).build();
    }

    @Test
    void init_loadsBundledDevices() {
        ProfileManager manager = new ProfileManager();

        manager.init();

        UserAgentProfile first = manager.profileFor(0);
        assertThat(first.getUserAgent()).contains("Mozilla/5.0");
        assertThat(first.getViewport().getWidth()).isPositive();
    }

    @Test
    void profileFor_sameSessionIdAlwaysGetsSameProfileAndIdsWrap() {
        ProfileManager manager = new ProfileManager();
        manager.load(List.of(
                profile("a", "UA-A", new ViewPort(1920, 1080)),
                profile("b", "UA-B", new ViewPort(1440, 900))));

        assertThat(manager.profileFor(0).getId()).isEqualTo("a");
        assertThat(manager.profileFor(1).getId()).isEqualTo("b");
        assertThat(manager.profileFor(2).getId()).isEqualTo("a");
        assertThat(manager.profileFor(1)).isSameAs(manager.profileFor(1));
    }

    @Test
    void load_skipsProfilesWithoutUserAgentOrViewport() {
        ProfileManager manager = new ProfileManager();
        List<UserAgentProfile> candidates = new ArrayList<>();
        candidates.add(profile("no-ua", " ", new ViewPort(1920, 1080)));
        candidates.add(profile("no-viewport", "UA", null));
        candidates.add(profile("zero-viewport", "UA", new ViewPort(0, 0)));
        candidates.add(null);
        candidates.add(profile("ok", "UA-OK", new ViewPort(1366, 768)));

        manager.load(candidates);

        assertThat(manager.profileFor(0).getId()).isEqualTo("ok");
        assertThat(manager.profileFor(3).getId()).isEqualTo("ok");
    }

    @Test
    void load_nothingUsable_throws() {
        ProfileManager manager = new ProfileManager();

        assertThatThrownBy(() -> manager.load(List.of(profile("bad", null, null))))
                .isInstanceOf(DeviceNotFoundException.class)
                .hasMessageContaining("No usable device profiles");
    }

    @Test
    void profileFor_beforeLoading_throws() {
        assertThatThrownBy(() -> new ProfileManager().profileFor(0)).isInstanceOf(DeviceNotFoundException.class);
    }
}
