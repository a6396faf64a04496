/**
 * vCenter VI/JSON integration layer.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.vcenterperf.vcenter.VimApi} – the remote operations a run needs.</li>
 *   <li>{@link org.tanzu.vcenterperf.vcenter.VimJsonClient} – WebClient implementation of them (session header, HTTP, JSON, faults).</li>
 *   <li>{@link org.tanzu.vcenterperf.vcenter.VimJsonCodec} – mapping between VI/JSON documents and the model types.</li>
 *   <li>{@link org.tanzu.vcenterperf.vcenter.RunContext} – cancellation shared by all calls of a run.</li>
 * </ul>
 *
 * <p>QueryPerf answers are polymorphic: entity results and value series are read into
 * typed variants, with every kind this client does not read kept as an "unsupported" variant.
 */
package org.tanzu.vcenterperf.vcenter;
