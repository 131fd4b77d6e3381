package io.stubhive.imposter.protocol;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.ImposterResponse;
import io.stubhive.imposter.model.TcpFraming;
import io.stubhive.imposter.model.TcpImposterRequest;
import io.stubhive.imposter.model.TcpMode;
import io.stubhive.imposter.model.TcpOptions;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TcpProtocolAdapterTest {

    private final List<String> received = new CopyOnWriteArrayList<>();
    private NettyResources resources;
    private TcpProtocolAdapter adapter;

    @BeforeEach
    void setUp() {
        resources = new NettyResources(AdapterSettings.DEFAULTS);
    }

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.stop();
        }
        resources.close();
    }

    private int start(TcpOptions options, RequestHandler handler) {
        adapter = new TcpProtocolAdapter(resources, handler, options);
        return adapter.start("127.0.0.1", null).getPort();
    }

    private static ImposterResponse data(String data) {
        ObjectNode payload = ImposterJson.objectNode();
        payload.put("data", data);
        return ImposterResponse.of(payload);
    }

    private RequestHandler echo(String prefix) {
        return request -> {
            String data = ((TcpImposterRequest) request).data();
            received.add(data);
            return data(prefix + data);
        };
    }

    private static Socket connect(int port) throws IOException {
        Socket socket = new Socket("127.0.0.1", port);
        socket.setSoTimeout(5000);
        return socket;
    }

    @Test
    void chunkFramingAnswersEachRead() throws Exception {
        int port = start(TcpOptions.DEFAULTS, echo("pong:"));

        try (Socket socket = connect(port)) {
            socket.getOutputStream().write("ping".getBytes(StandardCharsets.UTF_8));
            socket.getOutputStream().flush();

            byte[] reply = new byte[64];
            int read = socket.getInputStream().read(reply);

            assertThat(new String(reply, 0, read, StandardCharsets.UTF_8)).isEqualTo("pong:ping");
        }
        assertThat(received).containsExactly("ping");
    }

    @Test
    void delimiterFramingSplitsRequestsAndKeepsTheirOrder() throws Exception {
        int port = start(new TcpOptions(null, TcpFraming.delimiter("\n")), request -> {
            String data = ((TcpImposterRequest) request).data();
            received.add(data);
            if ("first".equals(data)) {
                sleep(200);
            }
            return data("got " + data);
        });

        try (Socket socket = connect(port)) {
            socket.getOutputStream().write("first\nsecond\nthird\n".getBytes(StandardCharsets.UTF_8));
            socket.getOutputStream().flush();
            BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

            assertThat(reader.readLine()).isEqualTo("got first");
            assertThat(reader.readLine()).isEqualTo("got second");
            assertThat(reader.readLine()).isEqualTo("got third");
        }
        assertThat(received).containsExactly("first", "second", "third");
    }

    @Test
    void closeFramingWaitsForHalfCloseAndThenCloses() throws Exception {
        int port = start(new TcpOptions(null, TcpFraming.close()), echo("whole:"));

        try (Socket socket = connect(port)) {
            OutputStream out = socket.getOutputStream();
            out.write("part one, ".getBytes(StandardCharsets.UTF_8));
            out.flush();
            sleep(50);
            out.write("part two".getBytes(StandardCharsets.UTF_8));
            out.flush();
            socket.shutdownOutput();

            byte[] reply = socket.getInputStream().readAllBytes();

            assertThat(new String(reply, StandardCharsets.UTF_8)).isEqualTo("whole:part one, part two");
        }
        assertThat(received).containsExactly("part one, part two");
    }

    @Test
    void binaryModeExchangesBase64() throws Exception {
        int port = start(new TcpOptions(TcpMode.BINARY, null), request -> {
            received.add(((TcpImposterRequest) request).data());
            return data("AwQ=");
        });

        try (Socket socket = connect(port)) {
            socket.getOutputStream().write(new byte[] {1, 2});
            socket.getOutputStream().flush();

            byte[] reply = new byte[2];
            InputStream in = socket.getInputStream();
            assertThat(in.read(reply)).isEqualTo(2);
            assertThat(reply).containsExactly(3, 4);
        }
        assertThat(received).containsExactly("AQI=");
    }

    @Test
    void resetClosesTheConnection() throws Exception {
        int port = start(TcpOptions.DEFAULTS, request -> ImposterResponse.connectionReset());

        try (Socket socket = connect(port)) {
            socket.getOutputStream().write("ping".getBytes(StandardCharsets.UTF_8));
            socket.getOutputStream().flush();

            int read;
            try {
                read = socket.getInputStream().read();
            } catch (SocketException reset) {
                read = -1;
            }
            assertThat(read).isEqualTo(-1);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
