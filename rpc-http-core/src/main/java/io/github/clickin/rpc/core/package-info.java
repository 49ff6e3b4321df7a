/**
 * Transport-neutral building blocks: procedure types, the error taxonomy and wire constants.
 */
package io.github.clickin.rpc.core;
