package com.bracketeer.model;

import java.util.List;

public record StageWithStageItems(
        Stage stage,
        List<StageItemWithRounds> stageItems
) {
}
