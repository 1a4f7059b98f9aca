package dumb.hilbert.lemma;

import dumb.hilbert.proof.Proof;
import dumb.hilbert.proof.ProofBuilder;
import dumb.hilbert.system.LogicSystem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classic propositional lemmas over implication and negation, named after their set.mm labels.
 * <p>
 * Some are derived step by step from A1/A2 with Modus Ponens, some cite other lemmas by
 * reference, and a few closed forms are imported as opaque statements. Every formula a reference
 * step states is an instance of the cited lemma's statement, or of its conclusion when the step
 * lists operands.
 */
public final class Lemmas {

    private static final Map<String, LemmaConstructor> CATALOGUE;

    static {
        var m = new LinkedHashMap<String, LemmaConstructor>();
        m.put("id", Lemmas::id);
        m.put("a1i", Lemmas::a1i);
        m.put("a2i", Lemmas::a2i);
        m.put("mpd", Lemmas::mpd);
        m.put("syl", Lemmas::syl);
        m.put("sylcom", Lemmas::sylcom);
        m.put("com12", Lemmas::com12);
        m.put("syl5", Lemmas::syl5);
        m.put("syl6", Lemmas::syl6);
        m.put("a1d", Lemmas::a1d);
        m.put("idd", Lemmas::idd);
        m.put("con1", Lemmas::con1);
        m.put("con1d", Lemmas::con1d);
        m.put("con2", Lemmas::con2);
        m.put("con2d", Lemmas::con2d);
        m.put("con3", Lemmas::con3);
        m.put("con3d", Lemmas::con3d);
        m.put("con4", Lemmas::con4);
        m.put("con4d", Lemmas::con4d);
        m.put("con1i", Lemmas::con1i);
        m.put("con2i", Lemmas::con2i);
        m.put("con3i", Lemmas::con3i);
        m.put("con4i", Lemmas::con4i);
        m.put("notnot", Lemmas::notnot);
        m.put("notnotr", Lemmas::notnotr);
        m.put("pm2.21", Lemmas::pm2_21);
        m.put("pm2.21d", Lemmas::pm2_21d);
        m.put("pm2.24", Lemmas::pm2_24);
        m.put("pm2.18", Lemmas::pm2_18);
        m.put("pm2.18d", Lemmas::pm2_18d);
        m.put("pm2.43", Lemmas::pm2_43);
        m.put("pm2.61", Lemmas::pm2_61);
        m.put("imim1", Lemmas::imim1);
        m.put("imim2", Lemmas::imim2);
        m.put("mt4d", Lemmas::mt4d);
        m.put("conax1", Lemmas::conax1);
        m.put("jarli", Lemmas::jarli);
        m.put("simplim", Lemmas::simplim);
        m.put("ja", Lemmas::ja);
        m.put("peirce", Lemmas::peirce);
        m.put("modus_tollens", Lemmas::modusTollens);
        CATALOGUE = Collections.unmodifiableMap(m);
    }

    private Lemmas() {
    }

    /** Lemma name to constructor, in declaration order. */
    public static Map<String, LemmaConstructor> catalogue() {
        return CATALOGUE;
    }

    /** id: φ → φ, from A1 twice, A2 once and two Modus Ponens steps. */
    public static Proof id(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "id");
        var s1 = lb.ref("s1", "φ → ( φ → φ )", "A1", "A1");
        var s2 = lb.ref("s2", "( φ → ( ( φ → φ ) → φ ) ) → ( ( φ → ( φ → φ ) ) → ( φ → φ ) )", "A2", "A2");
        var s3 = lb.ref("s3", "φ → ( ( φ → φ ) → φ )", "A1", "A1");
        var s4 = lb.infer("s4", s2, s3, "MP s3, s2");
        var res = lb.infer("res", s4, s1, "MP s1, s4");
        return lb.finish(res);
    }

    /** a1i: ψ → φ. Hyp: φ. */
    public static Proof a1i(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "a1i");
        var hyp = lb.hyp("a1i.1", "φ");
        var a1 = lb.ref("s1", "φ → ( ψ → φ )", "A1", "A1");
        return lb.finish(lb.infer("s2", a1, hyp, "MP a1i.1, s1"));
    }

    /** a2i: ( φ → ψ ) → ( φ → χ ). Hyp: φ → ( ψ → χ ). */
    public static Proof a2i(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "a2i");
        var hyp = lb.hyp("a2i.1", "φ → ( ψ → χ )");
        var a2 = lb.ref("s1", "( φ → ( ψ → χ ) ) → ( ( φ → ψ ) → ( φ → χ ) )", "A2", "A2");
        return lb.finish(lb.infer("s2", a2, hyp, "MP a2i.1, s1"));
    }

    /** mpd: φ → χ. Hyps: φ → ψ, φ → ( ψ → χ ). */
    public static Proof mpd(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "mpd");
        var h1 = lb.hyp("mpd.1", "φ → ψ");
        var h2 = lb.hyp("mpd.2", "φ → ( ψ → χ )");
        var a2 = lb.ref("s1", "( φ → ( ψ → χ ) ) → ( ( φ → ψ ) → ( φ → χ ) )", "A2", "A2");
        var s2 = lb.infer("s2", a2, h2, "MP mpd.2, s1");
        return lb.finish(lb.infer("s3", s2, h1, "MP mpd.1, s2"));
    }

    /** syl: φ → χ. Hyps: φ → ψ, ψ → χ. */
    public static Proof syl(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "syl");
        var h1 = lb.hyp("syl.1", "φ → ψ");
        var h2 = lb.hyp("syl.2", "ψ → χ");
        var a1 = lb.ref("s1", "( ψ → χ ) → ( φ → ( ψ → χ ) )", "A1", "A1");
        var s2 = lb.infer("s2", a1, h2, "MP syl.2, s1");
        var a2 = lb.ref("s3", "( φ → ( ψ → χ ) ) → ( ( φ → ψ ) → ( φ → χ ) )", "A2", "A2");
        var s4 = lb.infer("s4", a2, s2, "MP s2, s3");
        return lb.finish(lb.infer("s5", s4, h1, "MP syl.1, s4"));
    }

    /** sylcom: φ → ( ψ → θ ). Hyps: φ → ( ψ → χ ), ψ → ( χ → θ ). */
    public static Proof sylcom(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "sylcom");
        var h1 = lb.hyp("sylcom.1", "φ → ( ψ → χ )");
        var h2 = lb.hyp("sylcom.2", "ψ → ( χ → θ )");
        var s1 = lb.ref("s1", "( ψ → ( χ → θ ) ) → ( ( ψ → χ ) → ( ψ → θ ) )", "A2", "A2");
        var s2 = lb.infer("s2", s1, h2, "(ψ→χ)→(ψ→θ)");
        var s3 = lb.ref("s3", "( ( ψ → χ ) → ( ψ → θ ) ) → ( φ → ( ( ψ → χ ) → ( ψ → θ ) ) )", "A1", "A1 lift");
        var s4 = lb.infer("s4", s3, s2, "φ→((ψ→χ)→(ψ→θ))");
        var s5 = lb.ref("s5", "( φ → ( ( ψ → χ ) → ( ψ → θ ) ) ) → ( ( φ → ( ψ → χ ) ) → ( φ → ( ψ → θ ) ) )", "A2", "A2");
        var s6 = lb.infer("s6", s5, s4, "(φ→(ψ→χ))→(φ→(ψ→θ))");
        return lb.finish(lb.infer("s7", s6, h1, "φ→(ψ→θ)"));
    }

    /** com12: ψ → ( φ → χ ). Hyp: φ → ( ψ → χ ). */
    public static Proof com12(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "com12");
        var hyp = lb.hyp("com12.1", "φ → ( ψ → χ )");
        var s1 = lb.ref("s1", "ψ → ( φ → ψ )", "A1", "A1 ψ→(φ→ψ)");
        var s2 = lb.ref("s2", "( φ → ( ψ → χ ) ) → ( ( φ → ψ ) → ( φ → χ ) )", "A2", "A2 (φ,(ψ→χ))");
        var s3 = lb.infer("s3", s2, hyp, "(φ→ψ)→(φ→χ)");
        var s4 = lb.ref("s4", "( ( φ → ψ ) → ( φ → χ ) ) → ( ψ → ( ( φ → ψ ) → ( φ → χ ) ) )", "A1", "A1 lift");
        var s5 = lb.infer("s5", s4, s3, "ψ→((φ→ψ)→(φ→χ))");
        var s6 = lb.ref("s6", "( ψ → ( ( φ → ψ ) → ( φ → χ ) ) ) → ( ( ψ → ( φ → ψ ) ) → ( ψ → ( φ → χ ) ) )", "A2", "A2(ψ,...)");
        var s7 = lb.infer("s7", s6, s5, "(ψ→(φ→ψ))→(ψ→(φ→χ))");
        return lb.finish(lb.infer("s8", s7, s1, "ψ→(φ→χ)"));
    }

    /** syl5: χ → ( φ → θ ). Hyps: φ → ψ, χ → ( ψ → θ ). */
    public static Proof syl5(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "syl5");
        var h1 = lb.hyp("syl5.1", "φ → ψ");
        var h2 = lb.hyp("syl5.2", "χ → ( ψ → θ )");
        var s1 = lb.ref("s1", "( χ → ( ψ → θ ) ) → ( φ → ( χ → ( ψ → θ ) ) )", "A1", "A1");
        var s2 = lb.infer("s2", s1, h2, "MP syl5.2, s1");
        var s3 = lb.ref("s3", "χ → ( φ → ( ψ → θ ) )", "com12", "com12", s2);
        var s5 = lb.ref("s5", "( φ → ( ψ → θ ) ) → ( ( φ → ψ ) → ( φ → θ ) )", "A2", "A2");
        var s6 = lb.ref("s6", "( ( φ → ( ψ → θ ) ) → ( ( φ → ψ ) → ( φ → θ ) ) ) → ( χ → ( ( φ → ( ψ → θ ) ) → ( ( φ → ψ ) → ( φ → θ ) ) ) )", "A1", "A1");
        var s7 = lb.infer("s7", s6, s5, "MP s5, s6");
        var s8 = lb.ref("s8", "( χ → ( ( φ → ( ψ → θ ) ) → ( ( φ → ψ ) → ( φ → θ ) ) ) ) → ( ( χ → ( φ → ( ψ → θ ) ) ) → ( χ → ( ( φ → ψ ) → ( φ → θ ) ) ) )", "A2", "A2");
        var s9 = lb.infer("s9", s8, s7, "MP s7, s8");
        var s10 = lb.infer("s10", s9, s3, "MP s3, s9");
        var s11 = lb.ref("s11", "( φ → ψ ) → ( χ → ( φ → ψ ) )", "A1", "A1");
        var s12 = lb.infer("s12", s11, h1, "MP syl5.1, s11");
        var s13 = lb.ref("s13", "( χ → ( ( φ → ψ ) → ( φ → θ ) ) ) → ( ( χ → ( φ → ψ ) ) → ( χ → ( φ → θ ) ) )", "A2", "A2");
        var s14 = lb.infer("s14", s13, s10, "MP s10, s13");
        return lb.finish(lb.infer("res", s14, s12, "MP s12, s14"));
    }

    /** syl6: φ → ( ψ → θ ). Hyps: φ → ( ψ → χ ), χ → θ. */
    public static Proof syl6(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "syl6");
        var h1 = lb.hyp("syl6.1", "φ → ( ψ → χ )");
        var h2 = lb.hyp("syl6.2", "χ → θ");
        var s2 = lb.ref("s2", "( χ → θ ) → ( ψ → ( χ → θ ) )", "A1", "A1");
        var s3 = lb.ref("s3", "( ψ → ( χ → θ ) ) → ( ( ψ → χ ) → ( ψ → θ ) )", "A2", "A2");
        var s4 = lb.infer("s4", s2, h2, "MP syl6.2, s2");
        var s5 = lb.infer("s5", s3, s4, "MP s4, s3");
        var s6 = lb.ref("s6", "( ( ψ → χ ) → ( ψ → θ ) ) → ( φ → ( ( ψ → χ ) → ( ψ → θ ) ) )", "A1", "A1");
        var s7 = lb.infer("s7", s6, s5, "MP s5, s6");
        var s8 = lb.ref("s8", "( φ → ( ( ψ → χ ) → ( ψ → θ ) ) ) → ( ( φ → ( ψ → χ ) ) → ( φ → ( ψ → θ ) ) )", "A2", "A2");
        var s9 = lb.infer("s9", s8, s7, "MP s7, s8");
        return lb.finish(lb.infer("res", s9, h1, "MP syl6.1, s9"));
    }

    /** a1d: φ → ( χ → ψ ). Hyp: φ → ψ. */
    public static Proof a1d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "a1d");
        var hyp = lb.hyp("a1d.1", "φ → ψ");
        var s1 = lb.ref("s1", "ψ → ( χ → ψ )", "A1", "A1");
        var s2 = lb.ref("s2", "( ψ → ( χ → ψ ) ) → ( φ → ( ψ → ( χ → ψ ) ) )", "A1", "A1 (syl)");
        var s3 = lb.infer("s3", s2, s1, "MP s1, s2");
        var s4 = lb.ref("s4", "( φ → ( ψ → ( χ → ψ ) ) ) → ( ( φ → ψ ) → ( φ → ( χ → ψ ) ) )", "A2", "A2 (syl)");
        var s5 = lb.infer("s5", s4, s3, "MP s3, s4");
        return lb.finish(lb.infer("s6", s5, hyp, "MP hyp, s5"));
    }

    public static Proof idd(LogicSystem sys) {
        return imported(sys, "idd", "φ → ( ψ → ψ )");
    }

    /** con1: ( ¬ φ → ψ ) → ( ¬ ψ → φ ). */
    public static Proof con1(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con1");
        var s1 = lb.ref("s1", "( ¬ φ → ψ ) → ( ¬ φ → ψ )", "id", "id");
        return lb.finish(lb.ref("res", "( ¬ φ → ψ ) → ( ¬ ψ → φ )", "con1d", "con1d", s1));
    }

    /** con1d: φ → ( ¬ χ → ψ ). Hyp: φ → ( ¬ ψ → χ ). */
    public static Proof con1d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con1d");
        var h1 = lb.hyp("con1d.1", "φ → ( ¬ ψ → χ )");
        var s1 = lb.ref("s1", "χ → ¬ ¬ χ", "notnot", "notnot");
        var s2 = lb.ref("s2", "φ → ( ¬ ψ → ¬ ¬ χ )", "syl6", "syl6", h1, s1);
        return lb.finish(lb.ref("res", "φ → ( ¬ χ → ψ )", "con4d", "con4d", s2));
    }

    /** con2: ( φ → ¬ ψ ) → ( ψ → ¬ φ ). */
    public static Proof con2(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con2");
        var s1 = lb.ref("s1", "( φ → ¬ ψ ) → ( φ → ¬ ψ )", "id", "id");
        return lb.finish(lb.ref("res", "( φ → ¬ ψ ) → ( ψ → ¬ φ )", "con2d", "con2d", s1));
    }

    /** con2d: φ → ( χ → ¬ ψ ). Hyp: φ → ( ψ → ¬ χ ). */
    public static Proof con2d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con2d");
        var h1 = lb.hyp("con2d.1", "φ → ( ψ → ¬ χ )");
        var s1 = lb.ref("s1", "¬ ¬ ψ → ψ", "notnotr", "notnotr");
        var s2 = lb.ref("s2", "φ → ( ¬ ¬ ψ → ¬ χ )", "syl5", "syl5", s1, h1);
        return lb.finish(lb.ref("res", "φ → ( χ → ¬ ψ )", "con4d", "con4d", s2));
    }

    /** con3: ( φ → ψ ) → ( ¬ ψ → ¬ φ ). */
    public static Proof con3(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con3");
        var s1 = lb.ref("s1", "( φ → ψ ) → ( φ → ψ )", "id", "id");
        return lb.finish(lb.ref("res", "( φ → ψ ) → ( ¬ ψ → ¬ φ )", "con3d", "con3d", s1));
    }

    /** con3d: φ → ( ¬ χ → ¬ ψ ). Hyp: φ → ( ψ → χ ). */
    public static Proof con3d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con3d");
        var h1 = lb.hyp("con3d.1", "φ → ( ψ → χ )");
        var s1 = lb.ref("s1", "¬ ¬ ψ → ψ", "notnotr", "notnotr");
        var s2 = lb.ref("s2", "φ → ( ¬ ¬ ψ → χ )", "syl5", "syl5", s1, h1);
        return lb.finish(lb.ref("res", "φ → ( ¬ χ → ¬ ψ )", "con1d", "con1d", s2));
    }

    /** con4: ( ¬ φ → ¬ ψ ) → ( ψ → φ ), an alias of A3. */
    public static Proof con4(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con4");
        return lb.finish(lb.ref("res", "( ¬ φ → ¬ ψ ) → ( ψ → φ )", "A3", "A3"));
    }

    /** con4d: φ → ( χ → ψ ). Hyp: φ → ( ¬ ψ → ¬ χ ). */
    public static Proof con4d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "con4d");
        var h1 = lb.hyp("con4d.1", "φ → ( ¬ ψ → ¬ χ )");
        var s1 = lb.ref("s1", "( ¬ ψ → ¬ χ ) → ( χ → ψ )", "con4", "con4");
        var s2 = lb.ref("s2", "( ( ¬ ψ → ¬ χ ) → ( χ → ψ ) ) → ( φ → ( ( ¬ ψ → ¬ χ ) → ( χ → ψ ) ) )", "A1", "A1");
        var s3 = lb.infer("s3", s2, s1, "MP s1, s2");
        var s4 = lb.ref("s4", "( φ → ( ( ¬ ψ → ¬ χ ) → ( χ → ψ ) ) ) → ( ( φ → ( ¬ ψ → ¬ χ ) ) → ( φ → ( χ → ψ ) ) )", "A2", "A2");
        var s5 = lb.infer("s5", s4, s3, "MP s3, s4");
        return lb.finish(lb.infer("res", s5, h1, "MP con4d.1, s5"));
    }

    public static Proof con1i(LogicSystem sys) {
        return contrapositionInference(sys, "con1i", "¬ φ → ψ", "( ¬ φ → ψ ) → ( ¬ ψ → φ )", "con1");
    }

    public static Proof con2i(LogicSystem sys) {
        return contrapositionInference(sys, "con2i", "φ → ¬ ψ", "( φ → ¬ ψ ) → ( ψ → ¬ φ )", "con2");
    }

    public static Proof con3i(LogicSystem sys) {
        return contrapositionInference(sys, "con3i", "φ → ψ", "( φ → ψ ) → ( ¬ ψ → ¬ φ )", "con3");
    }

    public static Proof con4i(LogicSystem sys) {
        return contrapositionInference(sys, "con4i", "¬ φ → ¬ ψ", "( ¬ φ → ¬ ψ ) → ( ψ → φ )", "con4");
    }

    private static Proof contrapositionInference(LogicSystem sys, String name, String hypothesis, String closedForm, String ref) {
        var lb = new ProofBuilder(sys, name);
        var hyp = lb.hyp("hyp", hypothesis);
        var s1 = lb.ref("s1", closedForm, ref, ref);
        return lb.finish(lb.infer("res", s1, hyp, "MP hyp, s1"));
    }

    /** notnot: φ → ¬ ¬ φ. */
    public static Proof notnot(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "notnot");
        var s1 = lb.ref("s1", "¬ φ → ¬ φ", "id", "id");
        return lb.finish(lb.ref("res", "φ → ¬ ¬ φ", "con2i", "con2i", s1));
    }

    /** notnotr: ¬ ¬ φ → φ. */
    public static Proof notnotr(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "notnotr");
        var s1 = lb.ref("s1", "( ¬ φ → φ ) → φ", "pm2.18", "pm2.18");
        return lb.finish(lb.ref("res", "¬ ¬ φ → φ", "jarli", "jarli", s1));
    }

    /** pm2.21: ¬ φ → ( φ → ψ ). */
    public static Proof pm2_21(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "pm2.21");
        var s1 = lb.ref("s1", "¬ φ → ¬ φ", "id", "id");
        return lb.finish(lb.ref("res", "¬ φ → ( φ → ψ )", "pm2.21d", "pm2.21d", s1));
    }

    /** pm2.21d: φ → ( ψ → χ ). Hyp: φ → ¬ ψ. */
    public static Proof pm2_21d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "pm2.21d");
        var h1 = lb.hyp("pm2.21d.1", "φ → ¬ ψ");
        var s1 = lb.ref("s1", "φ → ( ¬ χ → ¬ ψ )", "a1d", "a1d", h1);
        return lb.finish(lb.ref("res", "φ → ( ψ → χ )", "con4d", "con4d", s1));
    }

    /** pm2.24: φ → ( ¬ φ → ψ ). */
    public static Proof pm2_24(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "pm2.24");
        var s1 = lb.ref("s1", "¬ φ → ( φ → ψ )", "pm2.21", "pm2.21");
        return lb.finish(lb.ref("res", "φ → ( ¬ φ → ψ )", "com12", "com12", s1));
    }

    /** pm2.18: ( ¬ φ → φ ) → φ, consequentia mirabilis. */
    public static Proof pm2_18(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "pm2.18");
        var s1 = lb.ref("s1", "( ¬ φ → φ ) → ( ¬ φ → φ )", "id", "id");
        return lb.finish(lb.ref("res", "( ¬ φ → φ ) → φ", "pm2.18d", "pm2.18d", s1));
    }

    /** pm2.18d: φ → ψ. Hyp: φ → ( ¬ ψ → ψ ). */
    public static Proof pm2_18d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "pm2.18d");
        var h1 = lb.hyp("pm2.18d.1", "φ → ( ¬ ψ → ψ )");
        var s1 = lb.ref("s1", "¬ ψ → ( ψ → ¬ ( ¬ ψ → ψ ) )", "pm2.21", "pm2.21");
        var s2 = lb.ref("s2", "φ → ( ¬ ψ → ¬ ( ¬ ψ → ψ ) )", "sylcom", "sylcom", h1, s1);
        return lb.finish(lb.ref("res", "φ → ψ", "mt4d", "mt4d", h1, s2));
    }

    public static Proof pm2_43(LogicSystem sys) {
        return imported(sys, "pm2.43", "( φ → ( φ → ψ ) ) → ( φ → ψ )");
    }

    public static Proof pm2_61(LogicSystem sys) {
        return imported(sys, "pm2.61", "( φ → ψ ) → ( ( ¬ φ → ψ ) → ψ )");
    }

    public static Proof imim1(LogicSystem sys) {
        return imported(sys, "imim1", "( φ → ψ ) → ( ( ψ → χ ) → ( φ → χ ) )");
    }

    public static Proof imim2(LogicSystem sys) {
        return imported(sys, "imim2", "( φ → ψ ) → ( ( χ → φ ) → ( χ → ψ ) )");
    }

    /** mt4d: φ → χ. Hyps: φ → ψ, φ → ( ¬ χ → ¬ ψ ). */
    public static Proof mt4d(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "mt4d");
        var h1 = lb.hyp("mt4d.1", "φ → ψ");
        var h2 = lb.hyp("mt4d.2", "φ → ( ¬ χ → ¬ ψ )");
        var s1 = lb.ref("s1", "φ → ( ψ → χ )", "con4d", "con4d", h2);
        return lb.finish(lb.ref("res", "φ → χ", "mpd", "mpd", h1, s1));
    }

    /** conax1: ¬ ( φ → ψ ) → ¬ ψ. */
    public static Proof conax1(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "conax1");
        var s1 = lb.ref("s1", "ψ → ( φ → ψ )", "A1", "A1");
        var s2 = lb.ref("s2", "( ψ → ( φ → ψ ) ) → ( ¬ ( φ → ψ ) → ¬ ψ )", "con3", "con3");
        return lb.finish(lb.infer("res", s2, s1, "MP s1, s2"));
    }

    /** jarli: ¬ φ → χ. Hyp: ( φ → ψ ) → χ. */
    public static Proof jarli(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "jarli");
        var h1 = lb.hyp("jarli.1", "( φ → ψ ) → χ");
        var s1 = lb.ref("s1", "¬ φ → ( φ → ψ )", "pm2.21", "pm2.21");
        return lb.finish(lb.ref("res", "¬ φ → χ", "syl", "syl", s1, h1));
    }

    /** simplim: ¬ ( φ → ψ ) → φ. */
    public static Proof simplim(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "simplim");
        var s1 = lb.ref("s1", "¬ φ → ( φ → ψ )", "pm2.21", "pm2.21");
        return lb.finish(lb.ref("res", "¬ ( φ → ψ ) → φ", "con1i", "con1i", s1));
    }

    /** ja: ( φ → ψ ) → χ. Hyps: ¬ φ → χ, ψ → χ. */
    public static Proof ja(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "ja");
        var h1 = lb.hyp("ja.1", "¬ φ → χ");
        var h2 = lb.hyp("ja.2", "ψ → χ");
        var s1 = lb.ref("s1", "( ψ → χ ) → ( ( φ → ψ ) → ( φ → χ ) )", "imim2", "imim2");
        var s2 = lb.infer("s2", s1, h2, "MP ja.2, s1");
        var s3 = lb.ref("s3", "( φ → χ ) → ( ( ¬ φ → χ ) → χ )", "pm2.61", "pm2.61");
        var s4 = lb.ref("s4", "( φ → ψ ) → ( ( ¬ φ → χ ) → χ )", "syl", "syl", s2, s3);
        var s5 = lb.ref("s5", "( ¬ φ → χ ) → ( ( φ → ψ ) → χ )", "com12", "com12", s4);
        return lb.finish(lb.infer("res", s5, h1, "MP ja.1, s5"));
    }

    /** peirce: ( ( φ → ψ ) → φ ) → φ. */
    public static Proof peirce(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "peirce");
        var s1 = lb.ref("s1", "¬ ( φ → ψ ) → φ", "simplim", "simplim");
        var s2 = lb.ref("s2", "( ( φ → ψ ) → φ ) → ( ( ¬ ( φ → ψ ) → φ ) → φ )", "pm2.61", "pm2.61");
        var s3 = lb.ref("s3", "( ¬ ( φ → ψ ) → φ ) → ( ( ( φ → ψ ) → φ ) → φ )", "com12", "com12", s2);
        return lb.finish(lb.infer("res", s3, s1, "MP s1, s3"));
    }

    /** Modus tollens: ¬ φ. Hyps: φ → ψ, ¬ ψ. */
    public static Proof modusTollens(LogicSystem sys) {
        var lb = new ProofBuilder(sys, "modus_tollens");
        var h1 = lb.hyp("h1", "φ → ψ");
        var h2 = lb.hyp("h2", "¬ ψ");
        var s1 = lb.ref("s1", "( φ → ψ ) → ( ¬ ψ → ¬ φ )", "con3", "con3");
        var s2 = lb.infer("s2", s1, h1, "MP h1, s1");
        return lb.finish(lb.infer("s3", s2, h2, "MP h2, s2"));
    }

    private static Proof imported(LogicSystem sys, String name, String statement) {
        var lb = new ProofBuilder(sys, name);
        return lb.finish(lb.opaque("res", statement, "Imported"));
    }
}
