package io.jamsession.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}
