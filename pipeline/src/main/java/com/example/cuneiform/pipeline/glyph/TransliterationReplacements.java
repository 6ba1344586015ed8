package com.example.cuneiform.pipeline.glyph;

import java.util.List;

/**
 * Literal rewrites applied to a normalized transliteration before glyph resolution. They replace
 * sign-list aliases and sign names written inline with the names the lookup tables know, and
 * settle a few reading spellings. Tables run in declaration order, entries within a table too.
 */
public final class TransliterationReplacements {

    // Sign-list numbers used inline when the reading is uncertain.
    private static final Replacement[] SIGN_LIST = {
            new Replacement("BAU377", "GIŠ"),
            new Replacement("KWU147", "LIL"),
            new Replacement("KWU354", "LUM"),
            new Replacement("KWU636", "KU₄"),
            new Replacement("KWU777", "ŠITA"),
            new Replacement("KWU844", "|E₂×AŠ@t|"),
            new Replacement("LAK060", "|UŠ×TAK₄|"),
            new Replacement("LAK085", "|SI×TAK₄|"),
            new Replacement("LAK173", "KAD₅"),
            new Replacement("LAK175", "SANGA₂"),
            new Replacement("LAK218", "|ZU&ZU.SAR|"),
            new Replacement("LAK449", "|NUNUZ.AB₂|"),
            new Replacement("LAK524", "|ZUM×TUG₂|"),
            new Replacement("LAK589", "GISAL"),
            new Replacement("LAK672a", "UŠX"),
            new Replacement("LAK672b", "MUNSUB"),
            new Replacement("LAK720", "|LAK648×(PAP.PAP.LU₃)|"),
            new Replacement("LAK769", "|LAGAB×AN|"),
            new Replacement("LAK777", "|DAG.KISIM₅×UŠ|"),
    };

    private static final Replacement[] SIGN_NAMES = {
            new Replacement("(ŠE.1(AŠ))", "(ŠE.AŠ)"),
            new Replacement("(ŠE.2(AŠ))", "(ŠE.AŠ.AŠ)"),
            new Replacement("|E₂.BALAG|", "|KID.BALAG|"),
            new Replacement("|SAHAR.DU₆.TAK₄|", "IŠ LAGAR@g TAK₄"),
            new Replacement("|ŠE.ŠE|", "ŠE ŠE"),
            new Replacement("(EN.ZU-TI.LA.BI-DU₁₁.GA)", "|EN.ZU| TI LA BI KA GA"),
            new Replacement("|EN₂.E₂|", "|ŠU₂.AN| E₂"),
            new Replacement("|TAB.BA|", "TAB BA"),
            new Replacement("|GAR.UD|", "GAR UD"),
            new Replacement("|NE.DAG|", "NE DAG"),
            new Replacement("|ŠU₂.DUN₃@g@g@s|", "|ŠU₂.DUN₃|"),
            new Replacement("BAD₃", "|EZEN×BAD|"),
            new Replacement("BIL₂", "NE@s"),
            new Replacement("DU₈", "DUH"),
            new Replacement("ERIM", "ERIN₂"),
            new Replacement("GAG", "KAK"),
            new Replacement("GIN₂", "DUN₃@g"),
            new Replacement("GU₄", "GUD"),
            new Replacement("GUB", "DU"),
            new Replacement("ITI", "|UD×(U.U.U)|"),
            new Replacement("MUNUS", "SAL"),
            new Replacement("NIG₂", "GAR"),
            new Replacement("ŠAG₄", "ŠA₃"),
            new Replacement("ŠE₃", "EŠ₂"),
            new Replacement("SILA₄", "|GA₂×PA|"),
            new Replacement("SIG₇", "IGI@g"),
            new Replacement("TUR₃", "|NUN.LAGAR|"),
            new Replacement("UH₃", "KUŠU₂"),
            new Replacement("U₈", "|LAGAB×(GUD&GUD)|"),
    };

    // Runs after the sign-name table, so some qualifiers are already rewritten.
    private static final Replacement[] READING_WITH_SIGN_NAME = {
            new Replacement("ad₆ ", "ad₆(|LU₂.LAGAB×U|) "),
            new Replacement("dabₓ(|LAGAB×(GUD&GUD)|)", "dibₓ(|LAGAB×(GUD&GUD)|)"),
            new Replacement("erinₓ(KWU896)", "erenₓ(KWU896)"),
            new Replacement("gurₓ(|ŠE.KIN|)še₃", "gurₓ(|ŠE.KIN|)-še₃"),
            new Replacement("gurumₓ(|IGI.ERIN₂|)", "gurum₂"),
            new Replacement("ilduₓ(NAGAR)", "nagar"),
            new Replacement("itiₓ(|UD@s×BAD|)", "iti₂(|UD@s×BAD|)"),
            new Replacement("itiₓ(|UD@s×TIL|)", "iti₂(|UD@s×BAD|)"),
            new Replacement("kuₓ(KU₄)", "ku₄"),
            new Replacement("lumₓ(LUM)", "lum"),
            new Replacement("mudₓ(|NUNUZ.AB₂|)", "mud₃(|NUNUZ.AB₂|)"),
            new Replacement("sangaₓ(|ŠID.GAR|)", "saŋŋaₓ(|ŠID.GAR|)"),
            new Replacement("šaganₓ(AMA)", "daŋal"),
            new Replacement("šitaₓ(ŠITA)", "šita"),
            new Replacement("tabₓ(MAN)", "tab₄"),
            new Replacement("umbinₓ(|UR₂×KID₂|)", "umbin(|UR₂×KID₂|)"),
            new Replacement("ušurₓ(|LAL₂×TUG₂|)", "ušurₓ(|LAL₂.TUG₂|)"),
            new Replacement("ugaₓ(NAGA)", "uga₃"),
            new Replacement("zeₓ(SIG₇)", "ziₓ(IGI@g)"),
            new Replacement("zeₓ(IGI@g)", "ziₓ(IGI@g)"),
    };

    private static final Replacement[] READINGS = {
            new Replacement("babila", "babilim"),
            new Replacement("eri₁₃", "ere₁₃"),
            new Replacement("eriš₂", "ereš₂"),
            new Replacement("šu+nigin₂", "šuniŋin"),
            new Replacement("šu+nigin", "šuniŋin"),
            new Replacement("+...", "..."),
            new Replacement("...+", "..."),
            new Replacement("@c", ""),
            new Replacement("@t", ""),
            new Replacement("@v", ""),
            new Replacement("@90", ""),
    };

    private static final Replacement[] FRACTIONS = {
            new Replacement("1/2(aš)", "1/2"),
            new Replacement("1/3(aš)", "1/3"),
            new Replacement("1/4(aš)", "1/4"),
            new Replacement("2/3(aš)", "2/3"),
            new Replacement("5/6(aš)", "5/6"),
    };

    private static final Replacement[] COMPOUNDS = {
            new Replacement("||LAGAB×(GUD&GUD)|+HUL₂|", "|LAGAB×(GUD&GUD)+HUL₂|"),
            new Replacement("||EZEN×BAD|.AN|", "|EZEN×BAD.AN|"),
            new Replacement("|NINDA₂×(ŠE.2(AŠ@c))|", "|NINDA₂×(ŠE.AŠ.AŠ)|"),
    };

    private static final List<Replacement[]> ALL = List.of(
            SIGN_LIST, SIGN_NAMES, READING_WITH_SIGN_NAME, READINGS, FRACTIONS, COMPOUNDS);

    private TransliterationReplacements() {
    }

    public static String apply(String transliteration) {
        String result = transliteration;
        for (Replacement[] table : ALL) {
            for (Replacement replacement : table) {
                result = result.replace(replacement.from(), replacement.to());
            }
        }
        return result;
    }

    private record Replacement(String from, String to) { }
}
