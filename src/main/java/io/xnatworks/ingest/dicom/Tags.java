/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.dicom;

/**
 * Tag constants for the attributes this project reads, encoded as
 * {@code (group << 16) | element}.
 */
public final class Tags {

    private Tags() {
    }

    // File meta information
    public static final int FileMetaInformationGroupLength = 0x00020000;
    public static final int FileMetaInformationVersion = 0x00020001;
    public static final int MediaStorageSOPClassUID = 0x00020002;
    public static final int MediaStorageSOPInstanceUID = 0x00020003;
    public static final int TransferSyntaxUID = 0x00020010;

    // Identification
    public static final int SpecificCharacterSet = 0x00080005;
    public static final int ImageType = 0x00080008;
    public static final int SOPClassUID = 0x00080016;
    public static final int SOPInstanceUID = 0x00080018;
    public static final int StudyDate = 0x00080020;
    public static final int Modality = 0x00080060;
    public static final int RecommendedDisplayFrameRate = 0x00082144;
    public static final int StudyDescription = 0x00081030;
    public static final int SeriesDescription = 0x0008103E;

    // Patient
    public static final int PatientName = 0x00100010;
    public static final int PatientID = 0x00100020;

    // Acquisition
    public static final int BodyPartExamined = 0x00180015;
    public static final int CineRate = 0x00180040;
    public static final int FrameTime = 0x00181063;
    public static final int FrameTimeVector = 0x00181065;

    // Relationship
    public static final int StudyInstanceUID = 0x0020000D;
    public static final int SeriesInstanceUID = 0x0020000E;
    public static final int SeriesNumber = 0x00200011;
    public static final int InstanceNumber = 0x00200013;

    // Image pixel description
    public static final int SamplesPerPixel = 0x00280002;
    public static final int PhotometricInterpretation = 0x00280004;
    public static final int PlanarConfiguration = 0x00280006;
    public static final int NumberOfFrames = 0x00280008;
    public static final int FrameIncrementPointer = 0x00280009;
    public static final int Rows = 0x00280010;
    public static final int Columns = 0x00280011;
    public static final int BitsAllocated = 0x00280100;
    public static final int BitsStored = 0x00280101;
    public static final int HighBit = 0x00280102;
    public static final int PixelRepresentation = 0x00280103;
    public static final int WindowCenter = 0x00281050;
    public static final int WindowWidth = 0x00281051;
    public static final int RescaleIntercept = 0x00281052;
    public static final int RescaleSlope = 0x00281053;

    public static final int PixelData = 0x7FE00010;

    // Item delimitation
    public static final int Item = 0xFFFEE000;
    public static final int ItemDelimitationItem = 0xFFFEE00D;
    public static final int SequenceDelimitationItem = 0xFFFEE0DD;

    public static int group(int tag) {
        return tag >>> 16;
    }

    public static int element(int tag) {
        return tag & 0xFFFF;
    }

    /**
     * Format a tag as {@code (gggg,eeee)}.
     */
    public static String toString(int tag) {
        return String.format("(%04X,%04X)", group(tag), element(tag));
    }
}
