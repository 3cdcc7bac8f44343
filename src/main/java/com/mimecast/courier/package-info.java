/**
 * The main package for Courier, an approval workflow to mailbox bridge.
 *
 * <p>Courier listens for approval webhook events, fetches the approved instance,
 * <br>extracts a title and amount from its form, downloads the attachments and forwards
 * <br>everything by mail to the mailbox configured for the approval category.
 *
 * <p>This project can be compiled into a runnable JAR.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar courier.jar
 *      java -jar courier.jar
 *       Approval to mail bridge
 *
 *       --server &lt;dir&gt;   Run as server with configuration directory
 * </pre>
 *
 * <h2>Configuration:</h2>
 * <pre>
 *      $ java -jar courier.jar --server cfg/
 * </pre>
 * <p>The directory must contain a {@code server.json5} file.
 * <br>Secrets may be stored with an {@code ENC:} prefix and are decrypted on load.
 */
package com.mimecast.courier;
