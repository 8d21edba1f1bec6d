package io.simconvert.core.step.standard;

import io.simconvert.core.step.StepLibrary;

/**
 * The catalog of schema conversions shipped with this release.
 *
 * <p>
 * Built once at class initialisation and shared read-only. A new schema release adds one
 * {@code register} call keyed by the current {@link #LATEST_VERSION} and bumps the constant.
 */
public final class StandardSteps {

    /** The schema version every document is brought up to. */
    public static final int LATEST_VERSION = 11;

    private static final StepLibrary LIBRARY = StepLibrary.builder()
            .register(0, "flatten series axes", new SeriesAxisFlattening())
            .register(1, "cultivar aliases to records", new CultivarAliasRecords())
            .register(2, "repair zone areas", new ZoneAreaRepair())
            .register(3, "add solute managers", new SoluteManagerInsertion())
            .register(4, "add soil temperature", new SoilTemperatureInsertion())
            .register(5, "rename root length density", new RootLengthDensityRename())
            .register(6, "sum soil water layers", new SoilWaterSumAggregation())
            .register(7, "replace apex with apex standard", new ApexStandardReplacement())
            .register(8, "wrap root partition fraction", new RootDemandFunctionWrap())
            .register(9, "unify organ constants", new OrganConstantUnification())
            .register(10, "rename non-structural to storage", new StorageRename())
            .build();

    private StandardSteps() {}

    /** Returns the shared, immutable standard catalog. */
    public static StepLibrary library() {
        return LIBRARY;
    }
}
