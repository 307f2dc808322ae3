/**
 * Parse-time machinery. Not part of the public API; types here may change
 * without notice.
 */
package com.questrail.vcd.internal;
