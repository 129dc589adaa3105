// Part of Rendercache
/**
 * Canonical encoding of property graphs into deterministic signatures.
 */
package com.machinezoo.rendercache.encoding;
