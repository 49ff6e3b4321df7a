/**
 * Collaborator interfaces implemented outside the transport: procedure execution, payload
 * transformation and error shaping.
 */
package io.github.clickin.rpc.server.spi;
