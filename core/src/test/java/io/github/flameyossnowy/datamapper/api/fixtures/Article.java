package io.github.flameyossnowy.datamapper.api.fixtures;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.property.PropertyOptions;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.types.FieldType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

public final class Article extends Resource {
    public static final Model<Article> MODEL = Model.define(Article.class, Article::new);

    public static final Property<Article, Long> ID = MODEL.property("id", FieldType.SERIAL,
        PropertyOptions.<Article, Long>options().key());
    public static final Property<Article, String> TITLE = MODEL.property("title", FieldType.STRING,
        PropertyOptions.<Article, String>options().required().uniqueIndex("title_slug"));
    public static final Property<Article, String> SLUG = MODEL.property("slug", FieldType.STRING,
        PropertyOptions.<Article, String>options()
            .uniqueIndex("title_slug")
            .defaultValue((article, property) -> TITLE.get(article).toLowerCase(Locale.ROOT).replace(' ', '-')));
    public static final Property<Article, String> BODY = MODEL.property("body", FieldType.TEXT,
        PropertyOptions.<Article, String>options().lazy("content"));
    public static final Property<Article, String> SUMMARY = MODEL.property("summary", FieldType.STRING,
        PropertyOptions.<Article, String>options().lazy("content", "preview"));
    public static final Property<Article, List<String>> TAGS = MODEL.property("tags", new StringListType(),
        PropertyOptions.<Article, List<String>>options().defaultValue(List.of()));
    public static final Property<Article, Integer> VIEWS = MODEL.property("views", Integer.class,
        PropertyOptions.<Article, Integer>options().defaultValue(0));
    public static final Property<Article, BigDecimal> RATING = MODEL.property("rating", FieldType.DECIMAL,
        PropertyOptions.<Article, BigDecimal>options().precision(4, 2));

    @Override
    public Model<Article> model() {
        return MODEL;
    }

    public static Article titled(String title) {
        Article article = new Article();
        TITLE.set(article, title);
        return article;
    }
}
