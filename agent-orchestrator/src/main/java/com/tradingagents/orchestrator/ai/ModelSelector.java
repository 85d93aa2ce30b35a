package com.tradingagents.orchestrator.ai;

import com.tradingagents.common.llm.ModelTier;

/**
 * Maps a requested {@link ModelTier} to a concrete Claude model.
 *
 * <ul>
 *   <li>{@code QUICK} → fast model: analyst tool loops and debate turns.</li>
 *   <li>{@code DEEP}  → strong model: research manager, trader and risk manager.</li>
 * </ul>
 */
public final class ModelSelector {

    public static final String DEFAULT_QUICK_MODEL = "claude-haiku-4-5-20251001";
    public static final String DEFAULT_DEEP_MODEL  = "claude-sonnet-4-6";

    private ModelSelector() { /* utility class */ }

    /**
     * @param deepModel  configured deep model; blank falls back to {@link #DEFAULT_DEEP_MODEL}
     * @param quickModel configured quick model; blank falls back to {@link #DEFAULT_QUICK_MODEL}
     */
    public static String selectModel(ModelTier tier, String deepModel, String quickModel) {
        if (tier == ModelTier.QUICK) {
            return quickModel == null || quickModel.isBlank() ? DEFAULT_QUICK_MODEL : quickModel;
        }
        return deepModel == null || deepModel.isBlank() ? DEFAULT_DEEP_MODEL : deepModel;
    }
}
