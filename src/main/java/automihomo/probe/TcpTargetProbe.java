package automihomo.probe;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Latency as the time to resolve the host and complete a TCP handshake.
 * The socket is closed right after connecting; nothing is sent.
 */
public final class TcpTargetProbe implements TargetProbe {

    @Override
    public long probe(ProbeTarget target, Duration timeout) throws ProbeException {
        long budgetMs = timeout.toMillis();
        long start = System.nanoTime();

        InetSocketAddress address = new InetSocketAddress(target.host(), target.port());
        if (address.isUnresolved()) {
            throw new ProbeException(ProbeFailure.UNRESOLVED, "cannot resolve " + target.host());
        }

        long remainingMs = budgetMs - elapsedMs(start);
        if (remainingMs <= 0) {
            throw new ProbeException(ProbeFailure.TIMEOUT, "resolution of " + target.host() + " used the whole budget");
        }

        try (Socket socket = new Socket()) {
            socket.connect(address, (int) Math.min(remainingMs, Integer.MAX_VALUE));
            return elapsedMs(start);
        } catch (SocketTimeoutException e) {
            throw new ProbeException(ProbeFailure.TIMEOUT, "connect to " + target.address() + " timed out", e);
        } catch (ConnectException e) {
            throw new ProbeException(ProbeFailure.REFUSED, "connect to " + target.address() + " refused", e);
        } catch (IOException e) {
            throw new ProbeException(ProbeFailure.IO_ERROR, "connect to " + target.address() + " failed: " + e.getMessage(), e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
