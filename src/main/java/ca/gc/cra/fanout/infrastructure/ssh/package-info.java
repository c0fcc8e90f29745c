/**
 * Remote shell transport backed by the local OpenSSH client.
 * <p><strong>Role:</strong> Adapter implementing {@link ca.gc.cra.fanout.application.port.RemoteShellTransport}.</p>
 * <p><strong>Security:</strong> Always runs with {@code BatchMode=yes} and {@code PasswordAuthentication=no}; the
 * operator's agent, keys, and {@code known_hosts} are used as-is.</p>
 */
package ca.gc.cra.fanout.infrastructure.ssh;
