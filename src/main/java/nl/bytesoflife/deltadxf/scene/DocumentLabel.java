package nl.bytesoflife.deltadxf.scene;

/**
 * A label of a CAD document tree: either a label carrying its own data, or a reference
 * to another label. {@code entry} is the label's tag path, e.g. {@code 0:1:1:2}.
 */
public sealed interface DocumentLabel permits DocumentLabel.Direct, DocumentLabel.Reference {

    String entry();

    /**
     * The label at the end of the reference chain.
     */
    DocumentLabel resolve();

    default boolean isReference() {
        return this instanceof Reference;
    }

    record Direct(String entry) implements DocumentLabel {
        @Override
        public DocumentLabel resolve() {
            return this;
        }

        @Override
        public String toString() {
            return entry;
        }
    }

    record Reference(String entry, DocumentLabel referred) implements DocumentLabel {
        @Override
        public DocumentLabel resolve() {
            DocumentLabel label = referred;
            while (label instanceof Reference ref) {
                label = ref.referred();
            }
            return label;
        }

        @Override
        public String toString() {
            return entry + " -> " + referred.entry();
        }
    }
}
