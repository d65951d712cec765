/**
 * Status domain: probing dependency services, deriving the application status, and answering
 * status queries against an append-only {@link com.beacon.statusservice.domain.StatusRepository}.
 *
 * <p>Nothing in this package depends on Spring or on the {@code infrastructure} adapters. The
 * adapters (store implementations, the systemd state provider, the scheduler) implement or drive
 * the interfaces declared here.
 */
package com.beacon.statusservice.domain;
