package com.mk.fx.qa.dbstress.cfg;

/**
 * Body of every failed dashboard request, shown to the user as a dismissible notification.
 *
 * @param error short title of the failure
 * @param details the underlying message, e.g. the engine's own error text
 */
public record ErrorResponse(String error, String details) {}
