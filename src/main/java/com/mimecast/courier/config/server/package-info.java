/**
 * Server configuration file and its accessors.
 *
 * <p>Configuration lives in {@code server.json5} inside the directory given with --server.
 * <br>Sections:
 * <ul>
 *     <li>`feishu` Open platform base URL, application credentials and timeout.</li>
 *     <li>`smtp` Outbound mail server, credentials and sender.</li>
 *     <li>`webhook` Event callback bind address, port and path.</li>
 *     <li>`form` Title and amount labels, default currency and nesting limit.</li>
 *     <li>`categories` Approval name to mailbox mapping.</li>
 *     <li>`workers` Event and download pool sizes.</li>
 * </ul>
 *
 * <p>String values prefixed with {@code ENC:} are decrypted while loading.
 *
 * @see com.mimecast.courier.main.Server
 */
package com.mimecast.courier.config.server;
