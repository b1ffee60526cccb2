/**
 * The dispatcher: binding owners, invoking signals, and deferring re-entrant unbinds.
 *
 * @see signals.dispatch.SignalDispatcher
 * @see signals.dispatch.ListenerBindingTable
 */
package signals.dispatch;
