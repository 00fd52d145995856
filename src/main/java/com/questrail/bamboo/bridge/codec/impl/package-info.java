/**
 * JSON implementation of the bridge codec, built on the Jackson tree model.
 *
 * <p>Payloads are UTF-8 JSON text. Scalars map onto
 * {@link com.questrail.bamboo.api.ScriptValue}; arrays and objects used where a
 * scalar is expected decode as absent.</p>
 */
package com.questrail.bamboo.bridge.codec.impl;
