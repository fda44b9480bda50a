package com.example.resumeparser.config;

import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.PipelineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Binds application properties under the {@code resume.pipeline} prefix to a strongly-typed
 * configuration object. Every heuristic weight used by extraction scoring, fallback decisions and
 * pipeline aggregation lives here so it can be tuned from {@code application.yml}.
 * <p>
 * A freshly constructed instance carries the defaults, which is how tests build components.
 */
@ConfigurationProperties(prefix = "resume.pipeline")
public class ResumePipelineProperties {

    private Extraction extraction = new Extraction();
    private Ocr ocr = new Ocr();
    private Scoring scoring = new Scoring();
    private Fallback fallback = new Fallback();
    private Parsing parsing = new Parsing();
    private Stages stages = new Stages();
    private Aggregation aggregation = new Aggregation();
    private Batch batch = new Batch();

    /**
     * Builds the immutable extraction options handed to each run.
     */
    public ExtractionConfig toExtractionConfig() {
        return new ExtractionConfig(
                ExtractionMethod.fromString(extraction.getPreferredMethod()),
                extraction.isUseFallback(),
                extraction.getMaxPages(),
                extraction.isCleanText(),
                ocr.getLanguages()
        );
    }

    /**
     * Builds the immutable pipeline options handed to each run.
     */
    public PipelineConfig toPipelineConfig() {
        return new PipelineConfig(
                toExtractionConfig(),
                stages.isEnhancementEnabled(),
                stages.isMatchingEnabled(),
                stages.getTargetJobDescription(),
                stages.isValidationEnabled(),
                stages.getMinParsingConfidence(),
                stages.getStageTimeout()
        );
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public void setOcr(Ocr ocr) {
        this.ocr = ocr;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public Parsing getParsing() {
        return parsing;
    }

    public void setParsing(Parsing parsing) {
        this.parsing = parsing;
    }

    public Stages getStages() {
        return stages;
    }

    public void setStages(Stages stages) {
        this.stages = stages;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    /**
     * Extraction defaults and the size thresholds used by automatic method selection.
     */
    public static class Extraction {
        /** {@code auto} or an {@link ExtractionMethod} name. */
        private String preferredMethod = "auto";
        private boolean useFallback = true;
        private Integer maxPages;
        private boolean cleanText = true;
        /** Documents below this size start with the fastest direct-text engine. */
        private long smallDocumentBytes = 5L * 1024 * 1024;
        /** Documents below this size start with the layout-preserving engine. */
        private long mediumDocumentBytes = 20L * 1024 * 1024;

        public String getPreferredMethod() {
            return preferredMethod;
        }

        public void setPreferredMethod(String preferredMethod) {
            this.preferredMethod = preferredMethod;
        }

        public boolean isUseFallback() {
            return useFallback;
        }

        public void setUseFallback(boolean useFallback) {
            this.useFallback = useFallback;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public boolean isCleanText() {
            return cleanText;
        }

        public void setCleanText(boolean cleanText) {
            this.cleanText = cleanText;
        }

        public long getSmallDocumentBytes() {
            return smallDocumentBytes;
        }

        public void setSmallDocumentBytes(long smallDocumentBytes) {
            this.smallDocumentBytes = smallDocumentBytes;
        }

        public long getMediumDocumentBytes() {
            return mediumDocumentBytes;
        }

        public void setMediumDocumentBytes(long mediumDocumentBytes) {
            this.mediumDocumentBytes = mediumDocumentBytes;
        }
    }

    /**
     * Tesseract settings. OCR stays unavailable unless enabled and the tessdata directory exists.
     */
    public static class Ocr {
        private boolean enabled = false;
        private String datapath = "/usr/share/tesseract-ocr/5/tessdata";
        private List<String> languages = new ArrayList<>(List.of("eng"));
        private int dpi = 300;
        private int pageSegMode = 6;
        /** Upper bound of simultaneous recognition jobs; 0 means one per available core. */
        private int maxConcurrentJobs = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDatapath() {
            return datapath;
        }

        public void setDatapath(String datapath) {
            this.datapath = datapath;
        }

        public List<String> getLanguages() {
            return languages;
        }

        public void setLanguages(List<String> languages) {
            this.languages = languages;
        }

        public int getDpi() {
            return dpi;
        }

        public void setDpi(int dpi) {
            this.dpi = dpi;
        }

        public int getPageSegMode() {
            return pageSegMode;
        }

        public void setPageSegMode(int pageSegMode) {
            this.pageSegMode = pageSegMode;
        }

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }

        /**
         * Resolves the effective number of recognition permits.
         */
        public int effectiveConcurrency() {
            int cores = Runtime.getRuntime().availableProcessors();
            return maxConcurrentJobs <= 0 ? cores : Math.min(maxConcurrentJobs, cores);
        }
    }

    /**
     * Weights of the extraction confidence heuristic.
     */
    public static class Scoring {
        private Map<ExtractionMethod, Double> baseReliability = defaultBaseReliability();
        /** Reliability assumed for an engine missing from {@link #baseReliability}. */
        private double unknownMethodReliability = 0.5;
        private int shortTextLength = 100;
        private int longTextLength = 500;
        private double lengthBonus = 0.1;
        private double keywordIncrement = 0.05;
        private double keywordBonusCap = 0.2;
        private double specialCharThreshold = 0.2;
        private double specialCharPenaltyFactor = 2.0;
        private List<String> keywords = new ArrayList<>(List.of(
                "experience", "education", "skills", "work", "university",
                "degree", "phone", "email", "address", "linkedin"));

        private static Map<ExtractionMethod, Double> defaultBaseReliability() {
            Map<ExtractionMethod, Double> weights = new EnumMap<>(ExtractionMethod.class);
            weights.put(ExtractionMethod.PDFBOX_LAYOUT, 0.9);
            weights.put(ExtractionMethod.TIKA, 0.85);
            weights.put(ExtractionMethod.PDFBOX_TEXT, 0.8);
            weights.put(ExtractionMethod.TESSERACT_OCR, 0.7);
            return weights;
        }

        public double reliabilityOf(ExtractionMethod method) {
            Double weight = baseReliability == null ? null : baseReliability.get(method);
            return weight == null ? unknownMethodReliability : weight;
        }

        public Map<ExtractionMethod, Double> getBaseReliability() {
            return baseReliability;
        }

        public void setBaseReliability(Map<ExtractionMethod, Double> baseReliability) {
            this.baseReliability = baseReliability;
        }

        public double getUnknownMethodReliability() {
            return unknownMethodReliability;
        }

        public void setUnknownMethodReliability(double unknownMethodReliability) {
            this.unknownMethodReliability = unknownMethodReliability;
        }

        public int getShortTextLength() {
            return shortTextLength;
        }

        public void setShortTextLength(int shortTextLength) {
            this.shortTextLength = shortTextLength;
        }

        public int getLongTextLength() {
            return longTextLength;
        }

        public void setLongTextLength(int longTextLength) {
            this.longTextLength = longTextLength;
        }

        public double getLengthBonus() {
            return lengthBonus;
        }

        public void setLengthBonus(double lengthBonus) {
            this.lengthBonus = lengthBonus;
        }

        public double getKeywordIncrement() {
            return keywordIncrement;
        }

        public void setKeywordIncrement(double keywordIncrement) {
            this.keywordIncrement = keywordIncrement;
        }

        public double getKeywordBonusCap() {
            return keywordBonusCap;
        }

        public void setKeywordBonusCap(double keywordBonusCap) {
            this.keywordBonusCap = keywordBonusCap;
        }

        public double getSpecialCharThreshold() {
            return specialCharThreshold;
        }

        public void setSpecialCharThreshold(double specialCharThreshold) {
            this.specialCharThreshold = specialCharThreshold;
        }

        public double getSpecialCharPenaltyFactor() {
            return specialCharPenaltyFactor;
        }

        public void setSpecialCharPenaltyFactor(double specialCharPenaltyFactor) {
            this.specialCharPenaltyFactor = specialCharPenaltyFactor;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }
    }

    /**
     * Thresholds that make an extraction result insufficient and trigger escalation.
     */
    public static class Fallback {
        private int minTextLength = 50;
        private double minConfidence = 0.5;
        private double maxPageErrorRatio = 0.3;
        private double maxSpecialCharRatio = 0.3;

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public double getMaxPageErrorRatio() {
            return maxPageErrorRatio;
        }

        public void setMaxPageErrorRatio(double maxPageErrorRatio) {
            this.maxPageErrorRatio = maxPageErrorRatio;
        }

        public double getMaxSpecialCharRatio() {
            return maxSpecialCharRatio;
        }

        public void setMaxSpecialCharRatio(double maxSpecialCharRatio) {
            this.maxSpecialCharRatio = maxSpecialCharRatio;
        }
    }

    /**
     * Weights of the parsing confidence: a blend of extraction confidence, contact completeness,
     * section coverage and content richness.
     */
    public static class Parsing {
        private double extractionWeight = 0.3;
        private double contactWeight = 0.2;
        private double sectionWeight = 0.2;
        private double contentWeight = 0.3;
        private double experienceRichness = 0.3;
        private double educationRichness = 0.2;
        private double skillsRichness = 0.2;
        private double summaryRichness = 0.1;

        public double getExtractionWeight() {
            return extractionWeight;
        }

        public void setExtractionWeight(double extractionWeight) {
            this.extractionWeight = extractionWeight;
        }

        public double getContactWeight() {
            return contactWeight;
        }

        public void setContactWeight(double contactWeight) {
            this.contactWeight = contactWeight;
        }

        public double getSectionWeight() {
            return sectionWeight;
        }

        public void setSectionWeight(double sectionWeight) {
            this.sectionWeight = sectionWeight;
        }

        public double getContentWeight() {
            return contentWeight;
        }

        public void setContentWeight(double contentWeight) {
            this.contentWeight = contentWeight;
        }

        public double getExperienceRichness() {
            return experienceRichness;
        }

        public void setExperienceRichness(double experienceRichness) {
            this.experienceRichness = experienceRichness;
        }

        public double getEducationRichness() {
            return educationRichness;
        }

        public void setEducationRichness(double educationRichness) {
            this.educationRichness = educationRichness;
        }

        public double getSkillsRichness() {
            return skillsRichness;
        }

        public void setSkillsRichness(double skillsRichness) {
            this.skillsRichness = skillsRichness;
        }

        public double getSummaryRichness() {
            return summaryRichness;
        }

        public void setSummaryRichness(double summaryRichness) {
            this.summaryRichness = summaryRichness;
        }
    }

    /**
     * Stage toggles and limits.
     */
    public static class Stages {
        private boolean enhancementEnabled = true;
        private boolean matchingEnabled = false;
        private String targetJobDescription;
        private boolean validationEnabled = true;
        private double minParsingConfidence = 0.3;
        private Duration stageTimeout;
        /** Upper bound of threads running timed stages, including ones still busy after a timeout. */
        private int maxStageThreads = 32;

        public boolean isEnhancementEnabled() {
            return enhancementEnabled;
        }

        public void setEnhancementEnabled(boolean enhancementEnabled) {
            this.enhancementEnabled = enhancementEnabled;
        }

        public boolean isMatchingEnabled() {
            return matchingEnabled;
        }

        public void setMatchingEnabled(boolean matchingEnabled) {
            this.matchingEnabled = matchingEnabled;
        }

        public String getTargetJobDescription() {
            return targetJobDescription;
        }

        public void setTargetJobDescription(String targetJobDescription) {
            this.targetJobDescription = targetJobDescription;
        }

        public boolean isValidationEnabled() {
            return validationEnabled;
        }

        public void setValidationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
        }

        public double getMinParsingConfidence() {
            return minParsingConfidence;
        }

        public void setMinParsingConfidence(double minParsingConfidence) {
            this.minParsingConfidence = minParsingConfidence;
        }

        public Duration getStageTimeout() {
            return stageTimeout;
        }

        public void setStageTimeout(Duration stageTimeout) {
            this.stageTimeout = stageTimeout;
        }

        public int getMaxStageThreads() {
            return maxStageThreads;
        }

        public void setMaxStageThreads(int maxStageThreads) {
            this.maxStageThreads = maxStageThreads;
        }
    }

    /**
     * Weights used to fold stage outputs into the pipeline-level scores.
     */
    public static class Aggregation {
        private double extractionWeight = 0.3;
        private double parsingWeight = 0.4;
        private double enhancementWeight = 0.3;
        /** Added instead of the enhancement term when no enhancement ran. */
        private double missingEnhancementBase = 0.2;

        private double qualityContactWeight = 0.2;
        private double qualityExperienceWeight = 0.3;
        private double qualityEducationWeight = 0.2;
        private double qualitySkillsWeight = 0.2;
        private double qualitySummaryWeight = 0.1;

        public double getExtractionWeight() {
            return extractionWeight;
        }

        public void setExtractionWeight(double extractionWeight) {
            this.extractionWeight = extractionWeight;
        }

        public double getParsingWeight() {
            return parsingWeight;
        }

        public void setParsingWeight(double parsingWeight) {
            this.parsingWeight = parsingWeight;
        }

        public double getEnhancementWeight() {
            return enhancementWeight;
        }

        public void setEnhancementWeight(double enhancementWeight) {
            this.enhancementWeight = enhancementWeight;
        }

        public double getMissingEnhancementBase() {
            return missingEnhancementBase;
        }

        public void setMissingEnhancementBase(double missingEnhancementBase) {
            this.missingEnhancementBase = missingEnhancementBase;
        }

        public double getQualityContactWeight() {
            return qualityContactWeight;
        }

        public void setQualityContactWeight(double qualityContactWeight) {
            this.qualityContactWeight = qualityContactWeight;
        }

        public double getQualityExperienceWeight() {
            return qualityExperienceWeight;
        }

        public void setQualityExperienceWeight(double qualityExperienceWeight) {
            this.qualityExperienceWeight = qualityExperienceWeight;
        }

        public double getQualityEducationWeight() {
            return qualityEducationWeight;
        }

        public void setQualityEducationWeight(double qualityEducationWeight) {
            this.qualityEducationWeight = qualityEducationWeight;
        }

        public double getQualitySkillsWeight() {
            return qualitySkillsWeight;
        }

        public void setQualitySkillsWeight(double qualitySkillsWeight) {
            this.qualitySkillsWeight = qualitySkillsWeight;
        }

        public double getQualitySummaryWeight() {
            return qualitySummaryWeight;
        }

        public void setQualitySummaryWeight(double qualitySummaryWeight) {
            this.qualitySummaryWeight = qualitySummaryWeight;
        }
    }

    public static class Batch {
        private int concurrency = 4;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }
}
