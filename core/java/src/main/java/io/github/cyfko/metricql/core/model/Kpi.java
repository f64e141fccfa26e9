package io.github.cyfko.metricql.core.model;

/**
 * Clinical metrics and key performance indicators the backend can compute.
 * <p>
 * Constant names are the backend metric identifiers and are emitted verbatim, e.g.
 * {@code metric_DTN: metric(metricId: DTN)}. Natural-language names ("door to needle",
 * "stroke severity", ...) are mapped to constants by the alias registry.
 * </p>
 * <p>
 * Constants prefixed with {@code AA_} are the quality-award indicators; the remaining ones
 * are raw registry variables and derived times.
 * </p>
 *
 * @since 1.0.0
 */
public enum Kpi {
    AA_DTN_LE60,
    AA_DTN_LE45,
    AA_DTG_LE120,
    AA_DTG_LE90,
    AA_RECANALIZATION,
    AA_IMAGING,
    AA_SWALLOWING_SCREENING,
    AA_ANTICOAGULANTS,
    AA_ANTITHROMBOTICS,
    AA_STROKE_UNIT,
    AGE,
    WAKEUP_STROKE,
    INHOSPITAL_STROKE,
    ARRIVAL_MODE,
    EMS_PRENOTIFICATION,
    ADMISSION_DEPARTMENT,
    FIRST_CONTACT_PLACE,
    HOSPITALIZED_IN,
    SEX,
    RISK_FACTORS_TYPE,
    BEFORE_ONSET_MEDICATION,
    BEFORE_ONSET_MEDICATION_AIS_TIA,
    BEFORE_ONSET_MEDICATION_ICH,
    BEFORE_ONSET_ANTIPLATELET_TYPE,
    BEFORE_ONSET_ANTICOAGULANT_TYPE,
    ADMISSION_NIHSS,
    PRESTROKE_MRS,
    GLUCOSE,
    CHOLESTEROL,
    SYSTOLIC_PRESSURE,
    DIASTOLIC_PRESSURE,
    INR_MODE,
    IMAGING_DONE,
    IMAGING_TYPE,
    OCCLUSION_FOUND,
    OCCLUSION_SITE,
    OLD_INFARCTS_SEEN,
    OLD_INFARCTS_TYPE,
    PERFUSION_DEFICIT_TYPE,
    PERFUSION_CORE,
    HYPOPERFUSION,
    STROKE_TYPE,
    STROKE_MIMICS_DIAGNOSIS,
    THROMBOLYSIS,
    THROMBECTOMY,
    THROMBOLYSIS_ONLY,
    THROMBOLYSIS_AND_THROMBECTOMY,
    RECANALIZATION,
    DTN,
    DTG_PRIMARY,
    DTG_SECONDARY,
    DIDO,
    DOOR_TO_REPERFUSION,
    MTICI_SCORE,
    NO_THROMBOLYSIS_REASON,
    NO_THROMBECTOMY_REASON,
    MT_COMPLICATIONS_TYPE,
    MT_COMPLICATIONS,
    THROMBOLYSIS_DRUGS,
    THROMBOLYSIS_DRUG_DOSE,
    THROMBOLYSIS_APPLICATION_DEPARTMENT,
    POST_RECANALIZATION_FINDINGS,
    POST_RECANALIZATION_FINDING_TYPE,
    HEMORRHAGIC_TRANSFORMATION,
    TIA_CLINICAL_SYMPTOMS,
    TIA_SYMPTOMS_DURATION,
    BLEEDING_SOURCE_FOUND,
    ICH_BLEEDING_VOLUME,
    ICH_SCORE,
    ICH_TREATMENT,
    ICH_TREATMENT_TYPE,
    ICH_TREATMENT_TYPE_EXTENDED,
    BLEEDING_REASON_FOUND,
    BLEEDING_REASON_TYPE,
    BLEEDING_ANTIDOTE_TO_ANTICOAGULANTS,
    ANTICOAGULANT_REVERSAL,
    ANTICOAGULANT_REVERSAL_GIVEN,
    INTRAVENTICULAR_HEMORRHAGE,
    INFRATENTORIAL_HEMORRHAGE,
    SAH_TREATMENT,
    SAH_TREATMENT_TYPE,
    NIMODIPINE,
    HUNT_HESS_SCORE,
    CVT_TREATMENT,
    CVT_TREATMENT_TYPE,
    POST_ACUTE_CARE,
    CRANIECTOMY,
    CRANIECTOMY_AGE_GT60,
    CAROTID_ARTERIES_IMAGING,
    CAROTID_STENOSIS,
    CAROTID_STENOSIS_LEVEL,
    CAROTID_ENDARTERECTOMY,
    CAROTID_ENDARTERECTOMY_STENOSIS_GT70,
    ATRIAL_FIBRILATION_FLUTTER,
    STROKE_ETIOLOGY_KNOWN_AIS,
    STROKE_ETIOLOGY_TYPE_AIS,
    STROKE_ETIOLOGY_KNOWN_AIS_TIA,
    STROKE_ETIOLOGY_TYPE_AIS_TIA,
    VTE_INTERVENTION_AIS,
    VTE_INTERVENTION_ICH,
    VTE_INTERVENTION_TYPE_AIS,
    VTE_INTERVENTION_TYPE_ICH,
    POST_STROKE_COMPLICATIONS,
    POST_STROKE_COMPLICATIONS_TYPE,
    DAY_1_TEMPERATURE_CHECKS,
    DAY_2_TEMPERATURE_CHECKS,
    DAY_3_TEMPERATURE_CHECKS,
    PARACETAMOL_ON_FEVER,
    DAY_1_HYPERGLYCEMIA_CHECKS,
    DAY_2_HYPERGLYCEMIA_CHECKS,
    DAY_3_HYPERGLYCEMIA_CHECKS,
    INSULIN_ON_HYPERGLYCEMIA,
    SWALLOWING_SCREENING,
    SWALLOWING_SCREENING_TYPE,
    SWALLOWING_SCREENING_PERFORMER,
    PHYSIOTHERAPY,
    OCCUPATIONAL_THERAPY,
    SPEECH_THERAPY,
    DISCHARGE_DESTINATION,
    DISCHARGE_MEDICATIONS,
    DISCHARGE_ANTICOAGULANTS_AFIB,
    DISCHARGE_ANTICOAGULANT_TYPE_AFIB,
    DISCHARGE_ANTIPLATELETS_NO_AFIB,
    DISCHARGE_ANTIPLATELET_TYPE_NO_AFIB,
    DISCHARGE_MRS,
    SMOKING_CESSATION,
    STROKE_MANAGEMENT_APPOINTMENT,
    THREE_MONTH_MRS,
    HOSPITAL_STAY,
    DISCHARGE_NIHSS,
    DTI,
    ONSET_TO_DOOR,
    DOOR_TO_IV_ANTIHYPERTENSIVE_INITIATION,
    DOOR_TO_SYS_BP_LT140,
    IV_ANTIHYPERTENSIVE_TO_SYS_BP_LT140,
    IV_ANTIHYPERTENSIVE,
    ACHIEVING_SYSTOLIC_PRESSURE_LT140,
    DOOR_TO_REVERSAL_INITIATION,
    NO_ANTICOAGULATION_REVERSAL_REASON,
    NO_ICH_TREATMENT_REASON,
    DOOR_TO_EVACUATION;

    /**
     * @return the backend metric identifier
     */
    public String metricId() {
        return name();
    }
}
