package com.whereq.vigil.scan;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.model.OpenPort;
import com.whereq.vigil.model.ScanTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Reports which of a fixed list of TCP ports accept a connection.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class TcpPortProbe implements TargetProbe {

    private static final Map<Integer, String> SERVICES = Map.ofEntries(
        Map.entry(21, "ftp"),
        Map.entry(22, "ssh"),
        Map.entry(23, "telnet"),
        Map.entry(25, "smtp"),
        Map.entry(53, "domain"),
        Map.entry(80, "http"),
        Map.entry(110, "pop3"),
        Map.entry(143, "imap"),
        Map.entry(443, "https"),
        Map.entry(465, "smtps"),
        Map.entry(587, "submission"),
        Map.entry(993, "imaps"),
        Map.entry(995, "pop3s"),
        Map.entry(2375, "docker"),
        Map.entry(3000, "ppp"),
        Map.entry(3306, "mysql"),
        Map.entry(5432, "postgresql"),
        Map.entry(6379, "redis"),
        Map.entry(8000, "http-alt"),
        Map.entry(8001, "vcom-tunnel"),
        Map.entry(8080, "http-proxy"),
        Map.entry(8443, "https-alt"),
        Map.entry(8899, "solana-rpc"),
        Map.entry(8900, "solana-ws"),
        Map.entry(9090, "zeus-admin"),
        Map.entry(9100, "jetdirect"));

    private final List<Integer> ports;
    private final Duration connectTimeout;

    @Autowired
    public TcpPortProbe(VigilProperties properties) {
        this(properties.getScan().getPorts(), properties.getScan().getConnectTimeout());
    }

    public TcpPortProbe(List<Integer> ports, Duration connectTimeout) {
        this.ports = List.copyOf(ports);
        this.connectTimeout = connectTimeout;
    }

    /**
     * Connects to every port at once, so a probe takes at most one connect timeout however many
     * ports are filtered. Ports still pending when the timeout elapses count as closed.
     */
    @Override
    public List<OpenPort> probe(ScanTarget target) throws IOException, InterruptedException {
        InetAddress address = InetAddress.getByName(target.getAddress());
        Set<Integer> accepted = new HashSet<>();
        List<SocketChannel> channels = new ArrayList<>();

        try (Selector selector = Selector.open()) {
            int pending = 0;
            for (int port : ports) {
                SocketChannel channel = SocketChannel.open();
                channels.add(channel);
                try {
                    channel.configureBlocking(false);
                    if (channel.connect(new InetSocketAddress(address, port))) {
                        accepted.add(port);
                    } else {
                        channel.register(selector, SelectionKey.OP_CONNECT, port);
                        pending++;
                    }
                } catch (IOException e) {
                    log.trace("{}:{} closed ({})", target.getAddress(), port, e.getMessage());
                }
            }

            long deadline = System.nanoTime() + connectTimeout.toNanos();
            while (pending > 0) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Probe of " + target.getAddress() + " cancelled");
                }
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    log.trace("{}: {} ports filtered", target.getAddress(), pending);
                    break;
                }
                selector.select(remainingMillis);

                Iterator<SelectionKey> selected = selector.selectedKeys().iterator();
                while (selected.hasNext()) {
                    SelectionKey key = selected.next();
                    selected.remove();
                    int port = (Integer) key.attachment();
                    try {
                        if (((SocketChannel) key.channel()).finishConnect()) {
                            accepted.add(port);
                        }
                    } catch (IOException e) {
                        log.trace("{}:{} closed ({})", target.getAddress(), port, e.getMessage());
                    }
                    key.cancel();
                    pending--;
                }
            }
        } finally {
            channels.forEach(TcpPortProbe::closeQuietly);
        }

        List<OpenPort> open = ports.stream()
            .filter(accepted::contains)
            .map(port -> OpenPort.builder()
                .port(port)
                .service(SERVICES.getOrDefault(port, "unknown"))
                .build())
            .collect(Collectors.toList());
        log.debug("Found {} open ports for {}", open.size(), target.getAddress());
        return open;
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.trace("Failed to close probe socket: {}", e.getMessage());
        }
    }
}
