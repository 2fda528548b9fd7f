package io.github.yok.rethinkdblink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class ProvisioningResultTest {

    @Test
    void statusLine_正常ケース_DB作成成功_作成メッセージが返ること() {
        ProvisioningResult result = ProvisioningResult.created(EntityKind.DATABASE, "default");

        assertEquals("[RethinkSession] --- Successfully created new DATABASE --- default",
                result.statusLine());
        assertTrue(result.isCreated());
        assertFalse(result.isFailed());
    }

    @Test
    void statusLine_正常ケース_既存テーブル_既存メッセージが返ること() {
        ProvisioningResult result = ProvisioningResult.alreadyExisted(EntityKind.TABLE, "users");

        assertEquals("[RethinkSession] --- TABLE already exists --- users", result.statusLine());
        assertFalse(result.getDetail().isPresent());
    }

    @Test
    void statusLine_正常ケース_スキップ_理由が含まれること() {
        ProvisioningResult result =
                ProvisioningResult.skipped(EntityKind.TABLE, "users", "database already existed");

        String line = result.statusLine();
        assertTrue(line.contains("Skipped TABLE --- users"));
        assertTrue(line.contains("database already existed"));
        assertEquals(ProvisioningOutcome.SKIPPED, result.getOutcome());
    }

    @Test
    void statusLine_異常ケース_原因付き失敗_詳細と根本原因が含まれること() {
        RuntimeException cause =
                new RuntimeException("wrapper", new IllegalStateException("disk full"));
        ProvisioningResult result = ProvisioningResult.failed(EntityKind.DATABASE, "default",
                "there was a problem creating the database", cause);

        String line = result.statusLine();
        assertTrue(line.startsWith("[RethinkSession] --- Failed to create new DATABASE --- default"));
        assertTrue(line.contains("there was a problem creating the database"));
        assertTrue(line.contains("disk full"));
        assertTrue(result.isFailed());
        assertEquals(cause, result.getCause().orElseThrow());
    }

    @Test
    void statusLine_異常ケース_原因なし失敗_詳細のみが含まれること() {
        ProvisioningResult result = ProvisioningResult.failed(EntityKind.TABLE, "users",
                "server reported no table created in default", null);

        assertEquals("[RethinkSession] --- Failed to create new TABLE --- users: "
                + "server reported no table created in default", result.statusLine());
        assertFalse(result.getCause().isPresent());
    }

    @Test
    void equals_正常ケース_原因の違いは無視されること() {
        ProvisioningResult a = ProvisioningResult.failed(EntityKind.TABLE, "t", "x",
                new RuntimeException("a"));
        ProvisioningResult b = ProvisioningResult.failed(EntityKind.TABLE, "t", "x",
                new RuntimeException("b"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
