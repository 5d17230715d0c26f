package com.github.alvarosanchez.spr.resolve;

import com.github.alvarosanchez.spr.config.ConfigDocument;

/**
 * Config document as found in a {@link ConfigStore}.
 *
 * @param key key the document was found under
 * @param location repository-relative path of the backing file
 * @param document parsed document
 * @param checksum digest of the file bytes the document was parsed from
 */
public record StoredConfig(ConfigKey key, String location, ConfigDocument document, String checksum) {
}
