package com.cache.infra.cluster;

/**
 * Optional property groups written over the base cluster properties.
 *
 * <p>Overlays run in declaration order, after the base properties:
 * <ol>
 *   <li>{@link #ENCRYPTION}</li>
 *   <li>{@link #BACKUPS}</li>
 * </ol>
 * A value written by an overlay always replaces the base value of the same property.
 */
enum ClusterOverlay {

    ENCRYPTION {
        @Override
        void apply(ClusterDraft draft, CacheClusterProps props) {
            var encryption = props.getEncryption();
            if (encryption == null) {
                return;
            }
            draft.override("AtRestEncryptionEnabled", encryption.atRest());
            draft.props().transitEncryptionEnabled(encryption.inTransit());
            if (encryption.kmsKey() != null) {
                draft.override("KmsKeyId", encryption.kmsKey().getKeyId());
            }
        }
    },

    BACKUPS {
        @Override
        void apply(ClusterDraft draft, CacheClusterProps props) {
            var backups = props.getBackups();
            if (backups == null) {
                return;
            }
            draft.props().snapshotRetentionLimit(backups.retention().toDays());
            if (backups.preferredWindow() != null) {
                draft.props().snapshotWindow(backups.preferredWindow());
            }
        }
    };

    abstract void apply(ClusterDraft draft, CacheClusterProps props);

    static void applyAll(ClusterDraft draft, CacheClusterProps props) {
        for (var overlay : values()) {
            overlay.apply(draft, props);
        }
    }
}
