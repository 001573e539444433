package im.arun.menubuilder.engine;

import lombok.Value;

import java.util.List;

/**
 * Ids removed by a delete, in pre-order, plus option-boxes that were demoted
 * to plain commands instead of being removed.
 */
@Value
public class DeletedSet {
    List<Long> deletedIds;
    List<Long> demotedIds;
}
