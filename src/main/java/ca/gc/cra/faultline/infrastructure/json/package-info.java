/**
 * Jackson streaming serialization of events and parsing of collector responses.
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.infrastructure.json;
