package im.arun.menubuilder.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A visual divider. Carries nothing but its id.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class SeparatorNode extends MenuNode {

    public SeparatorNode(long id) {
        super(id);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SEPARATOR;
    }

    @Override
    public String getLabel() {
        return null;
    }

    @Override
    public SeparatorNode withId(long newId) {
        return new SeparatorNode(newId);
    }
}
