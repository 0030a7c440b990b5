package org.akton.arn;

import java.util.Objects;
import org.akton.arn.id.TypeTag;
import org.akton.arn.id.TypedId;

/**
 * Staged builder for {@link Arn}.
 *
 * <p>Each stage only offers the next segment, so segments are supplied in canonical
 * order and a terminal method is only reachable once all of them are present:</p>
 * <pre>{@code
 * Outcome<Arn> issued = ArnBuilder.create()
 *     .partition("prod")
 *     .service("billing")
 *     .category("acct1")
 *     .generate(TypeTag.USER);
 *
 * Outcome<Arn> restored = ArnBuilder.forCodec(codec)
 *     .partition("prod")
 *     .service("billing")
 *     .category("acct1")
 *     .resourceId("usr_01h455vb4pex5vsknk084sn02q")
 *     .build();
 * }</pre>
 *
 * <p>Validation happens in the terminal call, through the codec, with the same rules
 * and error positions as {@link ArnCodec#parse(String)}.</p>
 */
public final class ArnBuilder {

    private ArnBuilder() {
    }

    /**
     * Starts a builder backed by {@link ArnCodec#standard()}.
     */
    public static PartitionStage create() {
        return forCodec(ArnCodec.standard());
    }

    public static PartitionStage forCodec(ArnCodec codec) {
        return new Steps(Objects.requireNonNull(codec, "codec must not be null"));
    }

    public interface PartitionStage {
        ServiceStage partition(String partition);
    }

    public interface ServiceStage {
        CategoryStage service(String service);
    }

    public interface CategoryStage {
        ResourceStage category(String category);

        /**
         * Skips to the identifier with an empty category.
         */
        default ResourceStage noCategory() {
            return category("");
        }
    }

    public interface ResourceStage {

        /**
         * Issues the ARN with a fresh identifier tagged with the codec's default tag.
         */
        Outcome<Arn> generate();

        Outcome<Arn> generate(TypeTag tag);

        FinalStage resourceId(TypedId resourceId);

        FinalStage resourceId(String resourceId);
    }

    public interface FinalStage {
        Outcome<Arn> build();
    }

    /**
     * One immutable snapshot per stage, so a stage held by the caller can be branched
     * any number of times without one branch seeing another's segments.
     */
    private static final class Steps
            implements PartitionStage, ServiceStage, CategoryStage, ResourceStage, FinalStage {

        private final ArnCodec codec;
        private final String partition;
        private final String service;
        private final String category;
        private final TypedId typedId;
        private final String idText;

        private Steps(ArnCodec codec) {
            this(codec, null, null, null, null, null);
        }

        private Steps(ArnCodec codec, String partition, String service, String category,
                      TypedId typedId, String idText) {
            this.codec = codec;
            this.partition = partition;
            this.service = service;
            this.category = category;
            this.typedId = typedId;
            this.idText = idText;
        }

        @Override
        public ServiceStage partition(String partition) {
            return new Steps(codec, partition, null, null, null, null);
        }

        @Override
        public CategoryStage service(String service) {
            return new Steps(codec, partition, service, null, null, null);
        }

        @Override
        public ResourceStage category(String category) {
            return new Steps(codec, partition, service, category, null, null);
        }

        @Override
        public Outcome<Arn> generate() {
            return codec.create(partition, service, category);
        }

        @Override
        public Outcome<Arn> generate(TypeTag tag) {
            return codec.create(partition, service, category, tag);
        }

        @Override
        public FinalStage resourceId(TypedId resourceId) {
            return new Steps(codec, partition, service, category, resourceId, null);
        }

        @Override
        public FinalStage resourceId(String resourceId) {
            return new Steps(codec, partition, service, category, null, resourceId);
        }

        @Override
        public Outcome<Arn> build() {
            if (typedId != null) {
                return codec.withId(partition, service, category, typedId);
            }
            return codec.withId(partition, service, category, idText);
        }
    }
}
