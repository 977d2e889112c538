package com.whereq.vigil.scan;

import com.whereq.vigil.model.OpenPort;
import com.whereq.vigil.model.ScanTarget;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TcpPortProbeTest {

    @Test
    void reportsListeningPortsOnly() throws Exception {
        try (ServerSocket open = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
             ServerSocket closing = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            int openPort = open.getLocalPort();
            int closedPort = closing.getLocalPort();
            closing.close();

            TcpPortProbe probe = new TcpPortProbe(List.of(openPort, closedPort), Duration.ofSeconds(1));
            List<OpenPort> found = probe.probe(new ScanTarget("127.0.0.1", "local"));

            assertThat(found).extracting(OpenPort::getPort).containsExactly(openPort);
            assertThat(found.get(0).getProtocol()).isEqualTo("tcp");
        }
    }

    @Test
    void unansweredPortsFinishWithinOneConnectTimeout() throws Exception {
        List<Integer> ports = IntStream.rangeClosed(9001, 9026).boxed().collect(Collectors.toList());
        TcpPortProbe probe = new TcpPortProbe(ports, Duration.ofMillis(500));

        long start = System.nanoTime();
        // reserved non-routable address: SYNs are dropped or the network is unreachable
        List<OpenPort> found = probe.probe(new ScanTarget("10.255.255.1", "filtered"));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(found).isEmpty();
        assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    void listeningPortIsFoundAmongManyClosedOnes() throws Exception {
        try (ServerSocket open = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            List<Integer> ports = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                try (ServerSocket released = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
                    ports.add(released.getLocalPort());
                }
            }
            ports.add(open.getLocalPort());

            List<OpenPort> found = new TcpPortProbe(ports, Duration.ofSeconds(2))
                .probe(new ScanTarget("127.0.0.1", "local"));

            assertThat(found).extracting(OpenPort::getPort).containsExactly(open.getLocalPort());
        }
    }

    @Test
    void unresolvableHostFails() {
        TcpPortProbe probe = new TcpPortProbe(List.of(22), Duration.ofMillis(200));

        assertThatThrownBy(() -> probe.probe(new ScanTarget("no-such-host.invalid", "x")))
            .isInstanceOf(UnknownHostException.class);
    }
}
