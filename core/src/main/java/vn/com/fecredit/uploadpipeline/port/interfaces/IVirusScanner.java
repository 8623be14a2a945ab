package vn.com.fecredit.uploadpipeline.port.interfaces;

import vn.com.fecredit.uploadpipeline.exception.ScanFileNotFoundException;
import vn.com.fecredit.uploadpipeline.exception.ScanTimeoutException;
import vn.com.fecredit.uploadpipeline.exception.ScannerUnavailableException;
import vn.com.fecredit.uploadpipeline.exception.VirusScanException;
import vn.com.fecredit.uploadpipeline.model.ScanResult;

import java.nio.file.Path;

/**
 * Pluggable virus scanner.
 */
public interface IVirusScanner {

    /**
     * Scans a file and returns its verdict.
     *
     * @throws ScanFileNotFoundException   if the file does not exist
     * @throws ScanTimeoutException        if the scanner did not answer in time
     * @throws ScannerUnavailableException if the scanner cannot be reached
     * @throws VirusScanException          for any other scanner error
     */
    ScanResult scan(Path file);

    boolean isAvailable();

    /**
     * Engine name recorded in scan metadata.
     */
    String getName();
}
