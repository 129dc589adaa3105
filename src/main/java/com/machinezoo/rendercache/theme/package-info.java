// Part of Rendercache
/**
 * Copy-on-write resolution of theme placeholders in property graphs.
 */
package com.machinezoo.rendercache.theme;
