/**
 * User persistence with digest-backed credential checks.
 *
 * <ul>
 *   <li>{@link com.webauth.userstore.UserStore}: load by credentials, load by id, create
 *   <li>{@link com.webauth.userstore.JdbcUserStore}: relational implementation on Spring JDBC
 *   <li>{@link com.webauth.userstore.UserSchemaMigration}: Flyway migration for the default table
 * </ul>
 */
package com.webauth.userstore;
