package ai.algovision.engine;

import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.protocol.EngineResponse;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class RequestSchedulerTest {
    private final List<EngineResponse> sent = new ArrayList<>();
    private final RequestScheduler scheduler = new RequestScheduler(sent::add);

    @Test
    void testNewRequestSupersedesActiveOne() {
        var first = scheduler.begin("d", "r1");
        var second = scheduler.begin("d", "r2");

        assertTrue(first.isCancelled());
        assertFalse(second.isCancelled());
        assertEquals(List.of(new EngineResponse.Cancelled("r1")), sent);
        assertEquals("r2", scheduler.activeRequest("d"));
    }

    @Test
    void testDocumentsDoNotInterfere() {
        var a = scheduler.begin("a", "r1");
        scheduler.begin("b", "r2");
        assertFalse(a.isCancelled());
        assertEquals(List.of(), sent);
    }

    @Test
    void testCancelReachesEveryDocumentSharingTheRequestId() {
        var a = scheduler.begin("a", "r");
        var b = scheduler.begin("b", "r");
        scheduler.cancel("r");

        assertTrue(a.isCancelled());
        assertTrue(b.isCancelled());
        assertEquals(List.of(new EngineResponse.Cancelled("r")), sent);
    }

    @Test
    void testCompletingOneDocumentKeepsTheOtherCancellable() {
        var a = scheduler.begin("a", "r");
        var b = scheduler.begin("b", "r");
        scheduler.complete("a", a);
        scheduler.cancel("r");

        assertFalse(a.isCancelled());
        assertTrue(b.isCancelled());
    }

    @Test
    void testCancelledRequestCannotEmit() {
        var token = scheduler.begin("d", "r1");
        scheduler.cancel("r1");
        assertFalse(scheduler.emitIfLive(token, new EngineResponse.Cancelled("late")));
        assertEquals(List.of(new EngineResponse.Cancelled("r1")), sent);
    }

    @Test
    void testCancelOfUnknownRequestIsAcknowledged() {
        scheduler.cancel("nope");
        assertEquals(List.of(new EngineResponse.Cancelled("nope")), sent);
    }

    @Test
    void testCompletedRequestIsNotCancelledAgain() {
        var token = scheduler.begin("d", "r1");
        assertTrue(scheduler.emitIfLive(token, new EngineResponse.InitDone(0)));
        scheduler.complete("d", token);
        assertNull(scheduler.activeRequest("d"));

        scheduler.begin("d", "r2");
        scheduler.cancelDocument("other");
        assertEquals(List.of(new EngineResponse.InitDone(0)), sent);
    }

    @Test
    void testCancelDocumentNotifiesOnce() {
        scheduler.begin("d", "r1");
        scheduler.cancelDocument("d");
        scheduler.cancelDocument("d");
        assertEquals(List.of(new EngineResponse.Cancelled("r1")), sent);
        assertNull(scheduler.activeRequest("d"));
    }
}
