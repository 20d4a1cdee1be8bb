/**
 * Flink job wiring: Kafka source and sinks, the signal gate, fingerprint
 * keying and the keyed aggregation operator.
 */
package com.faultline.flink;
