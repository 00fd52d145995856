/**
 * Rendering Engine Ports
 * =============================================================================
 *
 * <p>The embedded browser engine is an external collaborator. These interfaces
 * are the only way the runtime reaches it:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.bamboo.engine.RenderingEngine}: process-wide bootstrap
 *       and browser creation</li>
 *   <li>{@link com.questrail.bamboo.engine.EngineBrowser}: one page and its native
 *       window</li>
 *   <li>{@link com.questrail.bamboo.engine.EngineBrowserClient}: notifications the
 *       engine delivers back</li>
 * </ul>
 *
 * <p>Engine bindings live outside this repository. Page content rendering,
 * networking and process sandboxing are the engine's business.</p>
 */
package com.questrail.bamboo.engine;
