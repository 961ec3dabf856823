package json.tree;

/// Exception thrown when an edit would break the sibling-list invariants:
/// linking a node that already belongs to a container, linking a container
/// into its own subtree, addressing a node that is not a child of the given
/// parent, editing children through a reference node, or reusing a deleted node.
public class JsonLinkageException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    public JsonLinkageException(String message) {
        super(message);
    }
}
