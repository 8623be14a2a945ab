package vn.com.fecredit.uploadpipeline.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.uploadpipeline.exception.ScanFileNotFoundException;
import vn.com.fecredit.uploadpipeline.exception.ScanTimeoutException;
import vn.com.fecredit.uploadpipeline.exception.ScannerUnavailableException;
import vn.com.fecredit.uploadpipeline.exception.VirusScanException;
import vn.com.fecredit.uploadpipeline.model.ScanResult;
import vn.com.fecredit.uploadpipeline.port.interfaces.IVirusScanner;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Scanner backed by a clamd daemon reached over TCP.
 *
 * <p>
 * Uses the null-terminated command form: {@code zPING} for availability and
 * {@code zINSTREAM} to stream the file as length-prefixed chunks. Replies look like
 * {@code stream: OK} or {@code stream: Eicar-Signature FOUND}.
 */
public class ClamAvVirusScanner implements IVirusScanner {

    private static final Logger log = LoggerFactory.getLogger(ClamAvVirusScanner.class);

    public static final String NAME = "clamav";
    private static final int STREAM_CHUNK_SIZE = 8192;

    private final String host;
    private final int port;
    private final Duration timeout;

    public ClamAvVirusScanner(String host, int port, Duration timeout) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public ScanResult scan(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ScanFileNotFoundException("File to scan not found: " + file);
        }
        long started = System.nanoTime();
        String reply;
        long fileSize;
        try (Socket socket = connect()) {
            OutputStream out = socket.getOutputStream();
            out.write("zINSTREAM\0".getBytes(StandardCharsets.US_ASCII));
            fileSize = streamFile(file, new DataOutputStream(out));
            reply = readReply(socket.getInputStream());
        } catch (SocketTimeoutException e) {
            throw new ScanTimeoutException("clamd did not answer within " + timeout.toMillis() + " ms", e);
        } catch (ConnectException | UnknownHostException e) {
            throw new ScannerUnavailableException("clamd is not reachable at " + host + ":" + port, e);
        } catch (IOException e) {
            throw new VirusScanException("clamd scan of " + file.getFileName() + " failed: " + e.getMessage(), e);
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        log.debug("clamd replied '{}' for {} in {} ms", reply, file.getFileName(), duration.toMillis());
        return parseReply(reply, duration, fileSize);
    }

    @Override
    public boolean isAvailable() {
        try (Socket socket = connect()) {
            socket.getOutputStream().write("zPING\0".getBytes(StandardCharsets.US_ASCII));
            return "PONG".equals(readReply(socket.getInputStream()));
        } catch (IOException e) {
            log.debug("clamd availability check against {}:{} failed: {}", host, port, e.getMessage());
            return false;
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    private Socket connect() throws IOException {
        int timeoutMillis = (int) timeout.toMillis();
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    private long streamFile(Path file, DataOutputStream out) throws IOException {
        long total = 0;
        byte[] buffer = new byte[STREAM_CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.writeInt(read);
                out.write(buffer, 0, read);
                total += read;
            }
        }
        out.writeInt(0);
        out.flush();
        return total;
    }

    private String readReply(InputStream in) throws IOException {
        ByteArrayOutputStream reply = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1 && b != 0) {
            reply.write(b);
        }
        return reply.toString(StandardCharsets.US_ASCII).trim();
    }

    ScanResult parseReply(String reply, Duration duration, long fileSize) {
        if (reply.endsWith("OK")) {
            return ScanResult.clean(NAME, duration, fileSize);
        }
        if (reply.endsWith("FOUND")) {
            String signature = reply.substring(0, reply.length() - "FOUND".length()).trim();
            int colon = signature.indexOf(':');
            if (colon >= 0) {
                signature = signature.substring(colon + 1).trim();
            }
            return ScanResult.infected(NAME, signature, duration, fileSize);
        }
        throw new VirusScanException("Unexpected clamd reply: " + reply);
    }
}
