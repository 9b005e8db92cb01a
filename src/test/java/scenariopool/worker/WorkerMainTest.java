package scenariopool.worker;

import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerMainTest {

    @Test
    void requiresWorkerIdAndPort() {
        assertThrows(IllegalArgumentException.class, () -> WorkerMain.run(new String[0], Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> WorkerMain.run(new String[0], Map.of("WORKER_ID", "1")));
        assertThrows(IllegalArgumentException.class,
                () -> WorkerMain.run(new String[]{"one", "127.0.0.1", "9"}, Map.of()));
    }

    @Test
    void exitsWhenSupervisorIsUnreachable() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        int code = WorkerMain.run(new String[]{"5", "127.0.0.1", String.valueOf(port)}, Map.of());

        assertEquals(WorkerClient.EXIT_CONNECT_FAILED, code);
    }
}
