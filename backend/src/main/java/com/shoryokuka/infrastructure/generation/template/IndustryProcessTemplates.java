package com.shoryokuka.infrastructure.generation.template;

import com.shoryokuka.domain.plan.model.ProcessStep;
import com.shoryokuka.domain.plan.model.ProcessTemplate;

import java.util.List;

/**
 * Before/After work processes per industry, used when the hearing sheet carries no
 * process data of its own. Matching is by keyword containment on the industry tag,
 * first match wins.
 */
final class IndustryProcessTemplates {

    static final ProcessTemplate CONSTRUCTION = new ProcessTemplate("建設", List.of(
            new ProcessStep("顧客打合せ", "要件ヒアリング", "要件ヒアリング", 60, 60),
            new ProcessStep("図面作成", "CAD設計", "CAD設計", 120, 120),
            new ProcessStep("数量拾い出し", "手作業計算", "AI自動計算", 90, 10),
            new ProcessStep("単価確認", "見積依頼", "AIマッチング", 120, 15),
            new ProcessStep("見積書作成", "書類作成", "自動生成", 60, 10),
            new ProcessStep("顧客説明", "提案", "提案", 30, 30)
    ));

    static final ProcessTemplate MANUFACTURING = new ProcessTemplate("製造", List.of(
            new ProcessStep("受注処理", "注文確認・伝票起票", "自動取り込み", 30, 10),
            new ProcessStep("生産計画", "手動スケジューリング", "AI最適化", 45, 10),
            new ProcessStep("部材手配", "在庫確認・発注", "自動発注", 40, 10),
            new ProcessStep("加工", "手動作業", "自動化", 60, 30),
            new ProcessStep("検品", "目視確認", "AI検査", 45, 15),
            new ProcessStep("出荷準備", "梱包・伝票作成", "自動梱包", 30, 15)
    ));

    static final ProcessTemplate IT = new ProcessTemplate("IT", List.of(
            new ProcessStep("要件定義", "顧客ヒアリング", "顧客ヒアリング", 60, 60),
            new ProcessStep("設計", "手動設計書作成", "AI支援設計", 90, 30),
            new ProcessStep("コーディング", "手動開発", "AI支援開発", 120, 40),
            new ProcessStep("テスト", "手動テスト", "自動テスト", 60, 15),
            new ProcessStep("ドキュメント作成", "手動作成", "自動生成", 45, 10),
            new ProcessStep("デプロイ", "手動デプロイ", "自動デプロイ", 30, 10)
    ));

    static final ProcessTemplate FOOD_SERVICE = new ProcessTemplate("飲食", List.of(
            new ProcessStep("食材発注", "在庫確認・手動発注", "AI自動発注", 30, 5),
            new ProcessStep("仕込み", "手作業調理", "一部自動化", 60, 40),
            new ProcessStep("注文受付", "口頭・手書き", "タブレット注文", 20, 5),
            new ProcessStep("調理", "手作業調理", "調理支援機器", 45, 30),
            new ProcessStep("会計", "手動レジ", "自動精算", 15, 5),
            new ProcessStep("在庫管理", "手動棚卸し", "自動管理", 30, 5)
    ));

    static final ProcessTemplate SERVICE_CARE = new ProcessTemplate("サービス", List.of(
            new ProcessStep("予約管理", "手動台帳管理", "オンライン自動管理", 30, 5),
            new ProcessStep("顧客対応", "電話・来客対応", "AI自動応答併用", 45, 20),
            new ProcessStep("書類作成", "手動作成", "自動生成", 40, 10),
            new ProcessStep("実作業", "手作業", "機器支援", 60, 40),
            new ProcessStep("報告書作成", "手書き", "自動生成", 30, 5),
            new ProcessStep("請求処理", "手動計算", "自動計算", 25, 5)
    ));

    static final ProcessTemplate RETAIL = new ProcessTemplate("小売", List.of(
            new ProcessStep("発注業務", "手動発注・在庫確認", "AI自動発注", 30, 5),
            new ProcessStep("検品", "目視確認", "バーコード自動検品", 25, 10),
            new ProcessStep("陳列", "手作業", "最適配置提案", 30, 20),
            new ProcessStep("接客", "対面対応", "セルフ+有人併用", 40, 30),
            new ProcessStep("会計", "手動レジ", "セルフレジ", 20, 5),
            new ProcessStep("棚卸し", "手動カウント", "自動在庫管理", 45, 10)
    ));

    static final ProcessTemplate GENERIC = new ProcessTemplate("default", List.of(
            new ProcessStep("検査", "品質確認", "自動検査", 30, 10),
            new ProcessStep("準備", "セットアップ", "自動セット", 20, 15),
            new ProcessStep("加工", "手動作業", "自動化", 60, 30),
            new ProcessStep("検品", "目視確認", "AI検査", 45, 15),
            new ProcessStep("仕上げ", "調整", "効率化", 30, 20),
            new ProcessStep("梱包", "出荷準備", "効率化", 25, 20)
    ));

    private IndustryProcessTemplates() {
    }

    static ProcessTemplate forIndustry(String industry) {
        if (industry == null || industry.isBlank()) {
            return GENERIC;
        }
        if (industry.contains("建設") || industry.contains("建築")) {
            return CONSTRUCTION;
        }
        if (industry.contains("製造")) {
            return MANUFACTURING;
        }
        if (industry.contains("IT") || industry.contains("情報")) {
            return IT;
        }
        if (industry.contains("飲食")) {
            return FOOD_SERVICE;
        }
        if (industry.contains("サービス") || industry.contains("介護")) {
            return SERVICE_CARE;
        }
        if (industry.contains("小売")) {
            return RETAIL;
        }
        return GENERIC;
    }
}
