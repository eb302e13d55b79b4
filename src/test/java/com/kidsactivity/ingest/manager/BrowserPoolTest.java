package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.exception.BrowserPoolException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrowserPoolTest {

    @Test
    void start_skipsSessionsThatFailToLaunch() {
        BrowserPool pool = new BrowserPool((id, headless) -> {
            if (id == 1) throw new BrowserPoolException("chromium crashed on launch");
            return new FakeBrowserSession(id);
        });

        pool.start(3, true);

        assertThat(pool.size()).isEqualTo(2);
        assertThat(pool.liveSessions()).extracting(BrowserSession::getId).containsExactly(0, 2);
    }

    @Test
    void start_nothingLaunches_throws() {
        BrowserPool pool = new BrowserPool((id, headless) -> {
            throw new BrowserPoolException("no browser");
        });

        assertThatThrownBy(() -> pool.start(2, true))
                .isInstanceOf(BrowserPoolException.class)
                .hasMessageContaining("No browser session");
    }

    @Test
    void start_sizeBelowOne_isRejected() {
        BrowserPool pool = new BrowserPool((id, headless) -> new FakeBrowserSession(id));

        assertThatThrownBy(() -> pool.start(0, true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquire_dropsAndClosesDeadSessionsAndLeasesLiveOne() {
        FakeBrowserSession dead = FakeBrowserSession.dead(0);
        BrowserPool pool = new BrowserPool((id, headless) -> id == 0 ? dead : new FakeBrowserSession(id));
        pool.start(2, true);

        BrowserSession leased = pool.acquire();

        assertThat(leased.getId()).isEqualTo(1);
        assertThat(dead.isClosed()).isTrue();
        pool.release(leased);
        assertThat(pool.acquire()).isSameAs(leased);
    }

    @Test
    void acquire_allDead_throws() {
        BrowserPool pool = new BrowserPool((id, headless) -> FakeBrowserSession.dead(id));
        pool.start(2, true);

        assertThatThrownBy(pool::acquire)
                .isInstanceOf(BrowserPoolException.class)
                .hasMessageContaining("dead");
    }

    @Test
    void close_closesEverySession() {
        List<FakeBrowserSession> created = new ArrayList<>();
        BrowserPool pool = new BrowserPool((id, headless) -> {
            FakeBrowserSession s = new FakeBrowserSession(id);
            created.add(s);
            return s;
        });
        pool.start(3, false);

        pool.close();

        assertThat(created).allMatch(FakeBrowserSession::isClosed);
        assertThat(pool.liveSessions()).isEmpty();
    }
}
