/**
 * Jakarta Servlet binding for the procedure-call HTTP handler.
 */
package io.github.clickin.rpc.servlet;
