/**
 * Shared LeanWeb types: error classification, HTTP methods and constants, and the exception
 * hierarchy.
 *
 * <p>This module has no third-party dependencies.
 */
package io.leanweb.core;
