/**
 * Configuration foundation and utilities.
 *
 * <p>Files are JSON5, read leniently by Gson into maps and wrapped by typed accessors.
 * <br>Encrypted values are decrypted on load.
 *
 * <p>The Log4j2 XML filename can be configured via a system property called <i>log4j.configurationFile</i>.
 * <br><b>Example:</b>
 * <pre>java -Dlog4j.configurationFile=log4j2custom.xml -jar courier.jar --server cfg/</pre>
 */
package com.mimecast.courier.config;
