/**
 * JSON codec SPI. Keeps the server core independent of any particular JSON library.
 */
package io.github.clickin.rpc.json.spi;
