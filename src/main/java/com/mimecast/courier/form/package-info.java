/**
 * Approval form parsing and traversal.
 *
 * <p>The approval API returns the submitted form as JSON text: an array of controls,
 * <br>each with a name, a type key, a value and optional side-data in {@code ext}.
 * <br>The shape of value and side-data depends on the type and varies between templates.
 *
 * <h2>Control types:</h2>
 * <ul>
 *     <li><b>input</b> - Free text, parsed as {@link com.mimecast.courier.form.InputControl}</li>
 *     <li><b>amount</b> - Monetary value with currency in side-data</li>
 *     <li><b>fieldList</b> - Grouping control holding rows of nested controls and summaries</li>
 *     <li><b>attachment</b> / <b>attachmentV2</b> - Files, resolved into descriptors</li>
 *     <li><b>select</b> - Chosen option</li>
 * </ul>
 * <p>Anything else becomes an {@link com.mimecast.courier.form.UnknownControl} and is carried along untouched.
 *
 * <h2>Malformed input:</h2>
 * <p>Parsing never fails. Text that is not a JSON array yields an empty form
 * <br>and entries of the wrong shape are skipped.
 *
 * @see com.mimecast.courier.form.FormParser
 * @see com.mimecast.courier.form.FormWalker
 */
package com.mimecast.courier.form;
