/**
 * HTTP clients for the external collaborators: Matrix homeserver, chain service and
 * audit service. They use {@link java.net.http.HttpClient} and the hub's
 * {@link io.agenthub.util.JsonCodec}.
 */
package io.agenthub.http;
