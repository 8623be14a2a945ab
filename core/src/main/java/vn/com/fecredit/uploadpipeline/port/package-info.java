/**
 * Ports of the upload pipeline core. Interfaces in {@code interfaces} describe how the core
 * reaches persistence, chunk bytes, durable storage and the virus scanner; {@code impl}
 * holds the in-memory and local-filesystem adapters used when no other adapter is wired.
 */
package vn.com.fecredit.uploadpipeline.port;
