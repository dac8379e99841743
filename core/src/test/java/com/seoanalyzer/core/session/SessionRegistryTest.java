package com.seoanalyzer.core.session;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    @Test
    void session_id_combines_app_job_and_worker() {
        SessionRegistry reg = new SessionRegistry();
        SessionHandle h = reg.createSession("job-1", "security_agent");

        assertThat(h.getSessionId()).isEqualTo("seo_analyzer_job-1_security_agent");
        assertThat(h.getJobId()).isEqualTo("job-1");
        assertThat(h.getWorkerName()).isEqualTo("security_agent");
        assertThat(reg.find("job-1", "security_agent")).containsSame(h);
    }

    @Test
    void same_job_and_worker_cannot_be_issued_twice() {
        SessionRegistry reg = new SessionRegistry();
        reg.createSession("job-1", "security_agent");

        assertThatThrownBy(() -> reg.createSession("job-1", "security_agent"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(reg.size()).isEqualTo(1);
    }

    @Test
    void underscores_in_ids_do_not_make_keys_collide() {
        SessionRegistry reg = new SessionRegistry();
        SessionHandle left = reg.createSession("a_b", "c");
        SessionHandle right = reg.createSession("a", "b_c");

        assertThat(left).isNotSameAs(right);
        assertThat(reg.size()).isEqualTo(2);
        assertThat(reg.find("a_b", "c")).containsSame(left);
        assertThat(reg.find("a", "b_c")).containsSame(right);
    }

    @Test
    void sessions_do_not_share_turns() {
        SessionRegistry reg = new SessionRegistry();
        SessionHandle a = reg.createSession("job-1", "security_agent");
        SessionHandle b = reg.createSession("job-1", "onpage_agent");
        SessionHandle c = reg.createSession("job-2", "security_agent");

        a.appendTurn("user", "hello");
        a.appendTurn("model", null);

        assertThat(a.turns()).containsExactly(new SessionHandle.Turn("user", "hello"), new SessionHandle.Turn("model", ""));
        assertThat(b.turns()).isEmpty();
        assertThat(c.turns()).isEmpty();
        assertThat(reg.size()).isEqualTo(3);
    }

    @Test
    void turns_snapshot_is_read_only() {
        SessionHandle h = new SessionRegistry("custom").createSession("j", "w");
        assertThat(h.getSessionId()).isEqualTo("custom_j_w");
        assertThatThrownBy(() -> h.turns().add(new SessionHandle.Turn("user", "x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
