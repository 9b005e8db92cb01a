package scenariopool.coordinator.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunListenersTest {

    @Test
    void failingListenerDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        RunListeners listeners = new RunListeners();
        listeners.add(new RunListener() {
            @Override
            public void onWorkerRecycled(int workerId, String reason) {
                throw new IllegalStateException("listener bug");
            }
        });
        listeners.add(new RunListener() {
            @Override
            public void onWorkerRecycled(int workerId, String reason) {
                seen.add(workerId + ":" + reason);
            }
        });
        listeners.add(null);

        listeners.onWorkerRecycled(3, "scenario timeout");

        assertEquals(2, listeners.size());
        assertEquals(List.of("3:scenario timeout"), seen);
    }
}
