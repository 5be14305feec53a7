package com.skindx.infrastructure.ai;

/**
 * Keys of the task input map handed from stage modules to providers.
 */
public final class TaskInputKeys {

    public static final String DIAGNOSIS_ID = "diagnosis_id";
    public static final String IMAGE_PATH = "image_path";
    public static final String IMAGE_BYTES = "image_bytes";
    public static final String CLASSES = "classes";
    public static final String CATEGORIES = "categories";
    public static final String CATEGORY = "category";
    public static final String SUBCATEGORY = "subcategory";
    public static final String POSSIBLE_DISEASES = "possible_diseases";
    public static final String STAGE1_RESULT = "stage1_result";
    public static final String STAGE2_RESULT = "stage2_result";
    public static final String PATIENT_DATA = "patient_data";
    public static final String STAGE1 = "stage1";
    public static final String STAGE2 = "stage2";
    public static final String STAGE3 = "stage3";

    private TaskInputKeys() {
    }
}
