package io.github.yok.rethinkdblink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import io.github.yok.rethinkdblink.config.SessionConfig;
import io.github.yok.rethinkdblink.db.ConnectionHandle;
import io.github.yok.rethinkdblink.db.DatabaseReference;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RethinkSession}.
 */
class RethinkSessionTest {

    private final ConnectionHandle connection = mock(ConnectionHandle.class);

    @Test
    void getState_正常ケース_最後に到達した状態が返ること() {
        RethinkSession session = newSession(List.of(SessionState.DISCONNECTED,
                SessionState.CONNECTED, SessionState.DATABASE_CHECKED, SessionState.READY));

        assertEquals(SessionState.READY, session.getState());
        assertTrue(session.isReady());
    }

    @Test
    void isReady_正常ケース_READY未到達_falseが返ること() {
        RethinkSession session =
                newSession(List.of(SessionState.DISCONNECTED, SessionState.CONNECTED));

        assertFalse(session.isReady());
    }

    @Test
    void getStates_正常ケース_元のリストを変更しても影響を受けないこと() {
        List<SessionState> states = new ArrayList<>(List.of(SessionState.DISCONNECTED));
        RethinkSession session = newSession(states);
        states.add(SessionState.READY);

        assertEquals(1, session.getStates().size());
        assertThrows(UnsupportedOperationException.class,
                () -> session.getStates().add(SessionState.READY));
    }

    @Test
    void statusLines_正常ケース_DB_テーブルの順で返ること() {
        RethinkSession session = newSession(List.of(SessionState.READY));

        List<String> lines = session.statusLines();

        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("DATABASE"));
        assertTrue(lines.get(1).contains("TABLE"));
    }

    @Test
    void close_正常ケース_接続が閉じられること() {
        RethinkSession session = newSession(List.of(SessionState.READY));

        session.close();

        verify(connection).close();
    }

    private RethinkSession newSession(List<SessionState> states) {
        return new RethinkSession(SessionConfig.defaults(), connection,
                new DatabaseReference("default"),
                ProvisioningResult.created(EntityKind.DATABASE, "default"),
                ProvisioningResult.created(EntityKind.TABLE, "users"), states);
    }
}
