/**
 * Namespaced browser cookie lifecycle: issue, read and delete.
 *
 * <p>The manager never touches a global output stream. Callers hand it a
 * {@link com.webauth.cookie.ResponseHeaderWriter} and {@link com.webauth.cookie.RequestCookies};
 * {@link com.webauth.cookie.servlet} adapts both to Jakarta Servlet.
 */
package com.webauth.cookie;
