package io.github.cyfko.metricql.core.model;

/**
 * Named yes/no clinical properties of a case: performed treatments and medications taken
 * before stroke onset.
 *
 * @since 1.0.0
 */
public enum BooleanProperty {
    THROMBECTOMY,
    THROMBOLYSIS,
    BEFORE_ONSET_CILOSTAZOL,
    BEFORE_ONSET_CLOPIDOGREL,
    BEFORE_ONSET_TICAGRELOR,
    BEFORE_ONSET_TICLOPIDINE,
    BEFORE_ONSET_PRASUGREL,
    BEFORE_ONSET_DIPYRIDAMOLE,
    BEFORE_ONSET_OTHER_ANTIPLATELET,
    BEFORE_ONSET_ANY_ANTIPLATELET,
    BEFORE_ONSET_WARFARINS,
    BEFORE_ONSET_DABIGATRAN,
    BEFORE_ONSET_RIVAROXABAN,
    BEFORE_ONSET_APIXABAN,
    BEFORE_ONSET_EDOXABAN,
    BEFORE_ONSET_OTHER_ANTICOAGULANT,
    BEFORE_ONSET_ANY_ANTICOAGULANT,
    BEFORE_ONSET_STATIN,
    BEFORE_ONSET_HEPARIN,
    BEFORE_ONSET_CONTRACEPTION
}
