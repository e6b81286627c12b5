/**
 * Default implementations of the manager protocol codec ports.
 *
 * <p>Classes here hold no protocol semantics and no timing.</p>
 */
package com.questrail.callwatch.protocol.ami.codec.impl;
